package com.asl.search.api;

import com.asl.search.api.dto.ErrorResponse;
import com.asl.search.api.dto.SearchRequest;
import com.asl.search.api.dto.SearchResponse;
import com.asl.search.provider.SearchProviderUnavailableException;
import com.asl.search.scrape.FetchQueueUnavailableException;
import com.asl.search.scrape.ScrapeJobTimeoutException;
import com.asl.search.service.AgenticSearchService;
import com.asl.search.service.InvalidSearchRequestException;
import com.asl.search.service.ZeroDataRetentionUnsupportedException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);
    static final String DEFAULT_TEAM_ID = "anonymous";

    private final AgenticSearchService searchService;

    public SearchController(AgenticSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/v2/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-team-id", required = false) String teamIdHeader,
        @RequestHeader(value = "x-api-key-id", required = false) String apiKeyIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String requestId = normalizeOrGenerate(requestIdHeader);
        String teamId = normalize(teamIdHeader) == null ? DEFAULT_TEAM_ID : teamIdHeader.trim();

        Long apiKeyId;
        try {
            apiKeyId = parseApiKeyId(apiKeyIdHeader);
        } catch (NumberFormatException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "Invalid request headers", requestId,
                    List.of(new ErrorResponse.FieldError("x-api-key-id", "must be numeric")))
            );
        }

        try {
            SearchResponse response = searchService.search(request, teamId, apiKeyId, requestId);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            log.warn("invalid search request request_id={} errors={}", requestId, e.getFieldErrors().size());
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), requestId, e.getFieldErrors())
            );
        } catch (ZeroDataRetentionUnsupportedException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("zdr_unsupported", e.getMessage(), requestId)
            );
        } catch (ScrapeJobTimeoutException e) {
            return ResponseEntity.status(HttpStatus.REQUEST_TIMEOUT).body(
                new ErrorResponse("scrape_timeout", e.getMessage(), requestId)
            );
        } catch (SearchProviderUnavailableException e) {
            log.warn("search provider unavailable request_id={} error={}", requestId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("search_provider_unavailable", "Search provider is unavailable", requestId)
            );
        } catch (FetchQueueUnavailableException e) {
            log.warn("fetch queue unavailable request_id={} error={}", requestId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("fetch_queue_unavailable", "Fetch queue is unavailable", requestId)
            );
        } catch (Exception e) {
            log.error("unhandled error in search request_id={}", requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", requestId)
            );
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "invalid JSON", requestId)
        );
    }

    private Long parseApiKeyId(String value) {
        String normalized = normalize(value);
        return normalized == null ? null : Long.valueOf(normalized.trim());
    }

    private String normalizeOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return UUID.randomUUID().toString();
    }

    private String normalize(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return null;
    }
}
