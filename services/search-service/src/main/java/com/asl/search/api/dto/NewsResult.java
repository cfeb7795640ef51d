package com.asl.search.api.dto;

public class NewsResult extends SearchResultItem {
    private String snippet;
    private String date;
    private String imageUrl;

    public NewsResult() {
    }

    public NewsResult(String url, String title, String snippet, Integer position) {
        setUrl(url);
        setTitle(title);
        setPosition(position);
        this.snippet = snippet;
    }

    @Override
    public ResultCategory getType() {
        return ResultCategory.NEWS;
    }

    @Override
    public String similarityText() {
        return hasText(snippet) ? snippet : titleOrEmpty();
    }

    @Override
    public void applyFetched(String fetchedTitle, String fetchedDescription) {
        if (fetchedTitle != null) {
            setTitle(fetchedTitle);
        }
        if (fetchedDescription != null) {
            snippet = fetchedDescription;
        }
    }

    @Override
    public NewsResult copy() {
        NewsResult copy = copyBaseInto(new NewsResult());
        copy.setSnippet(snippet);
        copy.setDate(date);
        copy.setImageUrl(imageUrl);
        return copy;
    }

    public String getSnippet() {
        return snippet;
    }

    public void setSnippet(String snippet) {
        this.snippet = snippet;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }
}
