package com.asl.search.api.dto;

public class WebResult extends SearchResultItem {
    private String description;

    public WebResult() {
    }

    public WebResult(String url, String title, String description, Integer position) {
        setUrl(url);
        setTitle(title);
        setPosition(position);
        this.description = description;
    }

    @Override
    public ResultCategory getType() {
        return ResultCategory.WEB;
    }

    @Override
    public String similarityText() {
        return hasText(description) ? description : titleOrEmpty();
    }

    @Override
    public void applyFetched(String fetchedTitle, String fetchedDescription) {
        if (fetchedTitle != null) {
            setTitle(fetchedTitle);
        }
        if (fetchedDescription != null) {
            description = fetchedDescription;
        }
    }

    @Override
    public WebResult copy() {
        WebResult copy = copyBaseInto(new WebResult());
        copy.setDescription(description);
        return copy;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
