package com.asl.search.scrape;

import com.asl.search.api.dto.ResultCategory;
import com.asl.search.scrape.dto.ScrapedDocument;

/**
 * A submitted fetch job. Owned by the dispatcher that submitted it.
 */
public class ScrapeJobHandle {
    private final String jobId;
    private final String url;
    private final ResultCategory category;
    private final FetchJobQueue queue;

    public ScrapeJobHandle(String jobId, String url, ResultCategory category, FetchJobQueue queue) {
        this.jobId = jobId;
        this.url = url;
        this.category = category;
        this.queue = queue;
    }

    public ScrapedDocument await(long timeoutMs) {
        return queue.await(jobId, timeoutMs);
    }

    public void remove() {
        queue.remove(jobId);
    }

    public String getJobId() {
        return jobId;
    }

    public String getUrl() {
        return url;
    }

    public ResultCategory getCategory() {
        return category;
    }
}
