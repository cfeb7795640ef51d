package com.asl.search.scrape.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FetchSpec {
    private String url;
    private String mode = "single_urls";
    private String teamId;
    private String origin;
    private Map<String, Object> scrapeOptions;
    private long maxAgeMs;
    private String forceEngine;
    private boolean bypassBilling;
    private boolean zeroDataRetention;
    private Long apiKeyId;
    private int priority;
    private boolean directToQueue;
    private long startTime;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getTeamId() {
        return teamId;
    }

    public void setTeamId(String teamId) {
        this.teamId = teamId;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public Map<String, Object> getScrapeOptions() {
        return scrapeOptions;
    }

    public void setScrapeOptions(Map<String, Object> scrapeOptions) {
        this.scrapeOptions = scrapeOptions;
    }

    public long getMaxAgeMs() {
        return maxAgeMs;
    }

    public void setMaxAgeMs(long maxAgeMs) {
        this.maxAgeMs = maxAgeMs;
    }

    public String getForceEngine() {
        return forceEngine;
    }

    public void setForceEngine(String forceEngine) {
        this.forceEngine = forceEngine;
    }

    public boolean isBypassBilling() {
        return bypassBilling;
    }

    public void setBypassBilling(boolean bypassBilling) {
        this.bypassBilling = bypassBilling;
    }

    public boolean isZeroDataRetention() {
        return zeroDataRetention;
    }

    public void setZeroDataRetention(boolean zeroDataRetention) {
        this.zeroDataRetention = zeroDataRetention;
    }

    public Long getApiKeyId() {
        return apiKeyId;
    }

    public void setApiKeyId(Long apiKeyId) {
        this.apiKeyId = apiKeyId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isDirectToQueue() {
        return directToQueue;
    }

    public void setDirectToQueue(boolean directToQueue) {
        this.directToQueue = directToQueue;
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }
}
