package com.asl.search.scrape;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fetch-queue")
public class FetchQueueProperties {
    private String baseUrl = "http://localhost:8070";
    private int connectTimeoutMs = 1000;
    private int readTimeoutMs = 5000;
    // covers the longest request timeout plus the queue's own reply margin
    private int awaitReadTimeoutMs = 302000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getAwaitReadTimeoutMs() {
        return awaitReadTimeoutMs;
    }

    public void setAwaitReadTimeoutMs(int awaitReadTimeoutMs) {
        this.awaitReadTimeoutMs = awaitReadTimeoutMs;
    }
}
