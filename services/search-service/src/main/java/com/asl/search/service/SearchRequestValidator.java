package com.asl.search.service;

import com.asl.search.api.dto.ErrorResponse.FieldError;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.api.dto.SearchRequest;
import com.asl.search.category.CategoryMapBuilder;
import com.asl.search.completion.TextCompletionRegistry;
import com.asl.search.query.QueryExpander;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SearchRequestValidator {
    static final int MAX_QUERY_LENGTH = 500;
    static final int DEFAULT_LIMIT = 5;
    static final int MAX_LIMIT = 100;
    static final int DEFAULT_TIMEOUT_MS = 60000;
    static final int MIN_TIMEOUT_MS = 1000;
    static final int MAX_TIMEOUT_MS = 300000;
    static final String DEFAULT_LANG = "en";
    static final String DEFAULT_COUNTRY = "us";
    static final String DEFAULT_ORIGIN = "api";

    private final TextCompletionRegistry completionRegistry;
    private final SearchLoopProperties loopProperties;

    public SearchRequestValidator(TextCompletionRegistry completionRegistry, SearchLoopProperties loopProperties) {
        this.completionRegistry = completionRegistry;
        this.loopProperties = loopProperties;
    }

    public SearchCommand validate(SearchRequest request, String teamId, Long apiKeyId, String requestId) {
        if (request == null) {
            throw new InvalidSearchRequestException(
                "request body is required",
                List.of(new FieldError("body", "request body is required"))
            );
        }
        List<FieldError> errors = new ArrayList<>();
        SearchCommand command = new SearchCommand();
        command.setRequestId(requestId);
        command.setTeamId(teamId);
        command.setApiKeyId(apiKeyId);

        String query = QueryExpander.normalize(request.getQuery());
        if (query.isEmpty()) {
            errors.add(new FieldError("query", "must not be blank"));
        } else if (query.length() > MAX_QUERY_LENGTH) {
            errors.add(new FieldError("query", "must be at most " + MAX_QUERY_LENGTH + " characters"));
        }
        command.setQuery(query);

        int limit = request.getLimit() == null ? DEFAULT_LIMIT : request.getLimit();
        if (limit < 1 || limit > MAX_LIMIT) {
            errors.add(new FieldError("limit", "must be between 1 and " + MAX_LIMIT));
        }
        command.setLimit(limit);

        command.setSources(resolveSources(request.getSources(), errors));
        command.setCategories(resolveCategories(request.getCategories(), errors));

        int timeoutMs = request.getTimeout() == null ? DEFAULT_TIMEOUT_MS : request.getTimeout();
        if (timeoutMs < MIN_TIMEOUT_MS || timeoutMs > MAX_TIMEOUT_MS) {
            errors.add(new FieldError("timeout", "must be between " + MIN_TIMEOUT_MS + " and " + MAX_TIMEOUT_MS));
        }
        command.setTimeoutMs(timeoutMs);

        String backend = trimToNull(request.getCompletionBackend());
        if (backend != null && !completionRegistry.contains(backend)) {
            errors.add(new FieldError("completionBackend", "unknown completion backend: " + backend));
        }
        command.setCompletionBackend(backend);

        if (!errors.isEmpty()) {
            throw new InvalidSearchRequestException("Invalid request body", errors);
        }

        command.setTbs(trimToNull(request.getTbs()));
        command.setFilter(trimToNull(request.getFilter()));
        command.setLang(defaultIfBlank(request.getLang(), DEFAULT_LANG));
        command.setCountry(defaultIfBlank(request.getCountry(), DEFAULT_COUNTRY));
        command.setLocation(trimToNull(request.getLocation()));
        command.setOrigin(defaultIfBlank(request.getOrigin(), DEFAULT_ORIGIN));
        command.setIntegration(trimToNull(request.getIntegration()));
        command.setScrapeOptions(request.getScrapeOptions());
        command.setAsyncScraping(Boolean.TRUE.equals(request.getAsyncScraping()));
        command.setPreview(isPreview(request.getSearchPreviewToken()));
        return command;
    }

    private List<ResultCategory> resolveSources(List<String> sources, List<FieldError> errors) {
        if (sources == null || sources.isEmpty()) {
            return List.of(ResultCategory.WEB);
        }
        Set<ResultCategory> resolved = new LinkedHashSet<>();
        for (String source : sources) {
            ResultCategory category = ResultCategory.fromString(source);
            if (category == null) {
                errors.add(new FieldError("sources", "unsupported source: " + source));
            } else {
                resolved.add(category);
            }
        }
        return new ArrayList<>(resolved);
    }

    private List<String> resolveCategories(List<String> categories, List<FieldError> errors) {
        if (categories == null) {
            return List.of();
        }
        List<String> resolved = new ArrayList<>();
        for (String category : categories) {
            String normalized = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
            if (!CategoryMapBuilder.SUPPORTED.contains(normalized)) {
                errors.add(new FieldError("categories", "unsupported category: " + category));
            } else if (!resolved.contains(normalized)) {
                resolved.add(normalized);
            }
        }
        return resolved;
    }

    private boolean isPreview(String token) {
        String configured = loopProperties.getPreviewToken();
        return configured != null && !configured.isBlank() && configured.equals(token);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String defaultIfBlank(String value, String fallback) {
        String trimmed = trimToNull(value);
        return trimmed == null ? fallback : trimmed;
    }
}
