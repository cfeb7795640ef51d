package com.asl.search.provider.dto;

import com.asl.search.api.dto.ImageResult;
import com.asl.search.api.dto.NewsResult;
import com.asl.search.api.dto.WebResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderSearchResponse {
    private List<WebResult> web;
    private List<ImageResult> images;
    private List<NewsResult> news;

    public static ProviderSearchResponse empty() {
        ProviderSearchResponse response = new ProviderSearchResponse();
        response.setWeb(List.of());
        response.setImages(List.of());
        response.setNews(List.of());
        return response;
    }

    public List<WebResult> getWeb() {
        return web;
    }

    public void setWeb(List<WebResult> web) {
        this.web = web;
    }

    public List<ImageResult> getImages() {
        return images;
    }

    public void setImages(List<ImageResult> images) {
        this.images = images;
    }

    public List<NewsResult> getNews() {
        return news;
    }

    public void setNews(List<NewsResult> news) {
        this.news = news;
    }
}
