package com.asl.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.loop")
public class SearchLoopProperties {
    private int maxIterations = 2;
    private double convergenceThreshold = 0.6;
    private int maxVariants = 5;
    private int maxGapFacts = 5;
    private boolean enrichmentEnabled = true;
    private long requestDeadlineMs = 0L;
    private int resultBufferFactor = 2;
    private int maxSpans = 3;
    private String previewToken;

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double getConvergenceThreshold() {
        return convergenceThreshold;
    }

    public void setConvergenceThreshold(double convergenceThreshold) {
        this.convergenceThreshold = convergenceThreshold;
    }

    public int getMaxVariants() {
        return maxVariants;
    }

    public void setMaxVariants(int maxVariants) {
        this.maxVariants = maxVariants;
    }

    public int getMaxGapFacts() {
        return maxGapFacts;
    }

    public void setMaxGapFacts(int maxGapFacts) {
        this.maxGapFacts = maxGapFacts;
    }

    public boolean isEnrichmentEnabled() {
        return enrichmentEnabled;
    }

    public void setEnrichmentEnabled(boolean enrichmentEnabled) {
        this.enrichmentEnabled = enrichmentEnabled;
    }

    public long getRequestDeadlineMs() {
        return requestDeadlineMs;
    }

    public void setRequestDeadlineMs(long requestDeadlineMs) {
        this.requestDeadlineMs = requestDeadlineMs;
    }

    public int getResultBufferFactor() {
        return resultBufferFactor;
    }

    public void setResultBufferFactor(int resultBufferFactor) {
        this.resultBufferFactor = resultBufferFactor;
    }

    public int getMaxSpans() {
        return maxSpans;
    }

    public void setMaxSpans(int maxSpans) {
        this.maxSpans = maxSpans;
    }

    public String getPreviewToken() {
        return previewToken;
    }

    public void setPreviewToken(String previewToken) {
        this.previewToken = previewToken;
    }
}
