package com.asl.search.service;

import com.asl.search.api.dto.ResultCategory;
import java.util.List;
import java.util.Map;

/**
 * A validated search request with every default applied.
 */
public class SearchCommand {
    private String requestId;
    private String teamId;
    private Long apiKeyId;
    private String query;
    private int limit;
    private List<ResultCategory> sources;
    private List<String> categories;
    private String tbs;
    private String filter;
    private String lang;
    private String country;
    private String location;
    private int timeoutMs;
    private String origin;
    private String integration;
    private Map<String, Object> scrapeOptions;
    private boolean asyncScraping;
    private String completionBackend;
    private boolean preview;

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public String getTeamId() {
        return teamId;
    }

    public void setTeamId(String teamId) {
        this.teamId = teamId;
    }

    public Long getApiKeyId() {
        return apiKeyId;
    }

    public void setApiKeyId(Long apiKeyId) {
        this.apiKeyId = apiKeyId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public List<ResultCategory> getSources() {
        return sources;
    }

    public void setSources(List<ResultCategory> sources) {
        this.sources = sources;
    }

    public List<String> getCategories() {
        return categories;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories;
    }

    public String getTbs() {
        return tbs;
    }

    public void setTbs(String tbs) {
        this.tbs = tbs;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = lang;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public String getIntegration() {
        return integration;
    }

    public void setIntegration(String integration) {
        this.integration = integration;
    }

    public Map<String, Object> getScrapeOptions() {
        return scrapeOptions;
    }

    public void setScrapeOptions(Map<String, Object> scrapeOptions) {
        this.scrapeOptions = scrapeOptions;
    }

    public boolean isAsyncScraping() {
        return asyncScraping;
    }

    public void setAsyncScraping(boolean asyncScraping) {
        this.asyncScraping = asyncScraping;
    }

    public String getCompletionBackend() {
        return completionBackend;
    }

    public void setCompletionBackend(String completionBackend) {
        this.completionBackend = completionBackend;
    }

    public boolean isPreview() {
        return preview;
    }

    public void setPreview(boolean preview) {
        this.preview = preview;
    }
}
