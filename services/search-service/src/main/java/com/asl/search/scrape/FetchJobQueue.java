package com.asl.search.scrape;

import com.asl.search.scrape.dto.FetchSpec;
import com.asl.search.scrape.dto.ScrapedDocument;

public interface FetchJobQueue {
    String submit(FetchSpec spec);

    /**
     * Blocks until the job finishes.
     *
     * @throws ScrapeJobTimeoutException when the job has not finished within {@code timeoutMs}
     */
    ScrapedDocument await(String jobId, long timeoutMs);

    void remove(String jobId);
}
