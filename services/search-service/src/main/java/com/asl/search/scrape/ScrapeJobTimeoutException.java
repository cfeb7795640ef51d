package com.asl.search.scrape;

public class ScrapeJobTimeoutException extends RuntimeException {
    public static final String CODE = "SCRAPE_TIMEOUT";

    public ScrapeJobTimeoutException(String message) {
        super(message);
    }

    public ScrapeJobTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getCode() {
        return CODE;
    }
}
