package com.asl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class SearchRequest {
    private String query;
    private Integer limit;
    private List<String> sources;
    private List<String> categories;
    private String tbs;
    private String filter;
    private String lang;
    private String country;
    private String location;
    private Integer timeout;
    private String origin;
    private String integration;
    private Map<String, Object> scrapeOptions;
    private Boolean asyncScraping;
    private String completionBackend;

    @JsonProperty("__searchPreviewToken")
    private String searchPreviewToken;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
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

    public Integer getTimeout() {
        return timeout;
    }

    public void setTimeout(Integer timeout) {
        this.timeout = timeout;
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

    public Boolean getAsyncScraping() {
        return asyncScraping;
    }

    public void setAsyncScraping(Boolean asyncScraping) {
        this.asyncScraping = asyncScraping;
    }

    public String getCompletionBackend() {
        return completionBackend;
    }

    public void setCompletionBackend(String completionBackend) {
        this.completionBackend = completionBackend;
    }

    public String getSearchPreviewToken() {
        return searchPreviewToken;
    }

    public void setSearchPreviewToken(String searchPreviewToken) {
        this.searchPreviewToken = searchPreviewToken;
    }
}
