package com.asl.search.api.dto;

public class ImageResult extends SearchResultItem {
    private String imageUrl;
    private Integer imageWidth;
    private Integer imageHeight;

    public ImageResult() {
    }

    public ImageResult(String url, String title, String imageUrl, Integer position) {
        setUrl(url);
        setTitle(title);
        setPosition(position);
        this.imageUrl = imageUrl;
    }

    @Override
    public ResultCategory getType() {
        return ResultCategory.IMAGES;
    }

    @Override
    public String similarityText() {
        return titleOrEmpty();
    }

    @Override
    public void applyFetched(String fetchedTitle, String fetchedDescription) {
        if (fetchedTitle != null) {
            setTitle(fetchedTitle);
        }
    }

    @Override
    public ImageResult copy() {
        ImageResult copy = copyBaseInto(new ImageResult());
        copy.setImageUrl(imageUrl);
        copy.setImageWidth(imageWidth);
        copy.setImageHeight(imageHeight);
        return copy;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Integer getImageWidth() {
        return imageWidth;
    }

    public void setImageWidth(Integer imageWidth) {
        this.imageWidth = imageWidth;
    }

    public Integer getImageHeight() {
        return imageHeight;
    }

    public void setImageHeight(Integer imageHeight) {
        this.imageHeight = imageHeight;
    }
}
