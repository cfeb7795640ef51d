package com.asl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {
    private boolean success;
    private Data data;
    private ScrapeIds scrapeIds;
    private int creditsUsed;
    private int iterations;
    private String requestId;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public ScrapeIds getScrapeIds() {
        return scrapeIds;
    }

    public void setScrapeIds(ScrapeIds scrapeIds) {
        this.scrapeIds = scrapeIds;
    }

    public int getCreditsUsed() {
        return creditsUsed;
    }

    public void setCreditsUsed(int creditsUsed) {
        this.creditsUsed = creditsUsed;
    }

    public int getIterations() {
        return iterations;
    }

    public void setIterations(int iterations) {
        this.iterations = iterations;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Data {
        private List<EnrichedResult> web;
        private List<EnrichedResult> images;
        private List<EnrichedResult> news;

        public List<EnrichedResult> getWeb() {
            return web;
        }

        public void setWeb(List<EnrichedResult> web) {
            this.web = web;
        }

        public List<EnrichedResult> getImages() {
            return images;
        }

        public void setImages(List<EnrichedResult> images) {
            this.images = images;
        }

        public List<EnrichedResult> getNews() {
            return news;
        }

        public void setNews(List<EnrichedResult> news) {
            this.news = news;
        }

        public int size() {
            return sizeOf(web) + sizeOf(images) + sizeOf(news);
        }

        private static int sizeOf(List<EnrichedResult> list) {
            return list == null ? 0 : list.size();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ScrapeIds {
        private List<String> web;
        private List<String> images;
        private List<String> news;

        public List<String> getWeb() {
            return web;
        }

        public void setWeb(List<String> web) {
            this.web = web;
        }

        public List<String> getImages() {
            return images;
        }

        public void setImages(List<String> images) {
            this.images = images;
        }

        public List<String> getNews() {
            return news;
        }

        public void setNews(List<String> news) {
            this.news = news;
        }
    }
}
