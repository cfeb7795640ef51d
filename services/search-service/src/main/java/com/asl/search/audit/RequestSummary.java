package com.asl.search.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestSummary {
    public static final String MODE_SEARCH = "search";

    @JsonProperty("job_id")
    private String jobId;
    private boolean success;
    private String error;
    @JsonProperty("num_docs")
    private int numDocs;
    @JsonProperty("time_taken")
    private double timeTakenSeconds;
    @JsonProperty("team_id")
    private String teamId;
    private String mode = MODE_SEARCH;
    private String query;
    @JsonProperty("scrape_options")
    private Map<String, Object> scrapeOptions;
    private String origin;
    private String integration;
    @JsonProperty("credits_billed")
    private int creditsBilled;
    private int iterations;
    @JsonProperty("async_scraping")
    private boolean asyncScraping;

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getNumDocs() {
        return numDocs;
    }

    public void setNumDocs(int numDocs) {
        this.numDocs = numDocs;
    }

    public double getTimeTakenSeconds() {
        return timeTakenSeconds;
    }

    public void setTimeTakenSeconds(double timeTakenSeconds) {
        this.timeTakenSeconds = timeTakenSeconds;
    }

    public String getTeamId() {
        return teamId;
    }

    public void setTeamId(String teamId) {
        this.teamId = teamId;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Map<String, Object> getScrapeOptions() {
        return scrapeOptions;
    }

    public void setScrapeOptions(Map<String, Object> scrapeOptions) {
        this.scrapeOptions = scrapeOptions;
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

    public int getCreditsBilled() {
        return creditsBilled;
    }

    public void setCreditsBilled(int creditsBilled) {
        this.creditsBilled = creditsBilled;
    }

    public int getIterations() {
        return iterations;
    }

    public void setIterations(int iterations) {
        this.iterations = iterations;
    }

    public boolean isAsyncScraping() {
        return asyncScraping;
    }

    public void setAsyncScraping(boolean asyncScraping) {
        this.asyncScraping = asyncScraping;
    }
}
