package com.asl.search.retrieval;

import com.asl.search.api.dto.ImageResult;
import com.asl.search.api.dto.NewsResult;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.api.dto.SearchResultItem;
import com.asl.search.api.dto.WebResult;
import java.util.List;

/**
 * Per-category result lists for one iteration stage.
 */
public class ResultSet {
    private final List<WebResult> web;
    private final List<ImageResult> images;
    private final List<NewsResult> news;

    public ResultSet(List<WebResult> web, List<ImageResult> images, List<NewsResult> news) {
        this.web = web == null ? List.of() : web;
        this.images = images == null ? List.of() : images;
        this.news = news == null ? List.of() : news;
    }

    public static ResultSet empty() {
        return new ResultSet(List.of(), List.of(), List.of());
    }

    public List<? extends SearchResultItem> get(ResultCategory category) {
        switch (category) {
            case WEB:
                return web;
            case IMAGES:
                return images;
            case NEWS:
                return news;
            default:
                throw new IllegalArgumentException("Unknown category: " + category);
        }
    }

    public List<WebResult> getWeb() {
        return web;
    }

    public List<ImageResult> getImages() {
        return images;
    }

    public List<NewsResult> getNews() {
        return news;
    }

    public int size() {
        return web.size() + images.size() + news.size();
    }
}
