package com.asl.search.retrieval;

import com.asl.search.provider.dto.ProviderSearchResponse;

public class VariantSearchResult {
    private final String query;
    private final ProviderSearchResponse response;
    private final boolean error;
    private final String errorMessage;
    private final long tookMs;

    private VariantSearchResult(
        String query,
        ProviderSearchResponse response,
        boolean error,
        String errorMessage,
        long tookMs
    ) {
        this.query = query;
        this.response = response == null ? ProviderSearchResponse.empty() : response;
        this.error = error;
        this.errorMessage = errorMessage;
        this.tookMs = tookMs;
    }

    public static VariantSearchResult success(String query, ProviderSearchResponse response, long tookMs) {
        return new VariantSearchResult(query, response, false, null, tookMs);
    }

    public static VariantSearchResult error(String query, String message) {
        return new VariantSearchResult(query, ProviderSearchResponse.empty(), true, message, 0L);
    }

    public String getQuery() {
        return query;
    }

    public ProviderSearchResponse getResponse() {
        return response;
    }

    public boolean isError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public long getTookMs() {
        return tookMs;
    }
}
