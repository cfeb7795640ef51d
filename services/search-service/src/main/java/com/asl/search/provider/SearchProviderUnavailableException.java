package com.asl.search.provider;

public class SearchProviderUnavailableException extends RuntimeException {
    public SearchProviderUnavailableException(String message) {
        super(message);
    }

    public SearchProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
