package com.asl.search.scrape;

public class FetchQueueUnavailableException extends RuntimeException {
    public FetchQueueUnavailableException(String message) {
        super(message);
    }

    public FetchQueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
