package com.asl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One provider hit. Identity is the URL; {@code position} is the 1-based rank,
 * as reported by the provider before fusion and as reassigned after it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class SearchResultItem {
    private String url;
    private String title;
    private Integer position;
    private String category;

    @JsonIgnore
    public abstract ResultCategory getType();

    /**
     * Text compared against queries: the snippet when it is non-blank, the title otherwise.
     */
    public abstract String similarityText();

    /**
     * Overlays title/description fields fetched from the page; null values keep the search fields.
     */
    public abstract void applyFetched(String fetchedTitle, String fetchedDescription);

    public abstract SearchResultItem copy();

    protected <T extends SearchResultItem> T copyBaseInto(T target) {
        target.setUrl(url);
        target.setTitle(title);
        target.setPosition(position);
        target.setCategory(category);
        return target;
    }

    protected String titleOrEmpty() {
        return title == null ? "" : title;
    }

    protected static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }
}
