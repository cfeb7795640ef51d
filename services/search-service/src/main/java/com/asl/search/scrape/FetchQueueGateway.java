package com.asl.search.scrape;

import com.asl.search.scrape.dto.FetchSpec;
import com.asl.search.scrape.dto.ScrapedDocument;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class FetchQueueGateway implements FetchJobQueue {
    private static final Logger log = LoggerFactory.getLogger(FetchQueueGateway.class);

    private final RestTemplate restTemplate;
    private final RestTemplate awaitRestTemplate;
    private final FetchQueueProperties properties;

    public FetchQueueGateway(
        @Qualifier("fetchQueueRestTemplate") RestTemplate restTemplate,
        @Qualifier("fetchQueueAwaitRestTemplate") RestTemplate awaitRestTemplate,
        FetchQueueProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.awaitRestTemplate = awaitRestTemplate;
        this.properties = properties;
    }

    @Override
    public String submit(FetchSpec spec) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                buildUrl("/jobs"),
                HttpMethod.POST,
                new HttpEntity<>(spec, headers),
                JsonNode.class
            );
            String jobId = response.getBody() == null ? null : response.getBody().path("id").asText(null);
            if (jobId == null || jobId.isBlank()) {
                throw new FetchQueueUnavailableException("Fetch queue returned no job id");
            }
            return jobId;
        } catch (ResourceAccessException e) {
            throw new FetchQueueUnavailableException("Fetch queue unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new FetchQueueUnavailableException("Fetch queue error: " + e.getStatusCode(), e);
        }
    }

    @Override
    public ScrapedDocument await(String jobId, long timeoutMs) {
        try {
            ResponseEntity<ScrapedDocument> response = awaitRestTemplate.exchange(
                buildUrl("/jobs/" + jobId + "/result?timeoutMs=" + timeoutMs),
                HttpMethod.GET,
                HttpEntity.EMPTY,
                ScrapedDocument.class
            );
            if (response.getBody() == null) {
                throw new FetchQueueUnavailableException("Fetch queue returned no document for job " + jobId);
            }
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.REQUEST_TIMEOUT.value()) {
                throw new ScrapeJobTimeoutException("Scrape job " + jobId + " timed out after " + timeoutMs + "ms", e);
            }
            throw new FetchQueueUnavailableException("Fetch queue error: " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new ScrapeJobTimeoutException("Scrape job " + jobId + " did not answer in time", e);
        }
    }

    @Override
    public void remove(String jobId) {
        try {
            restTemplate.exchange(buildUrl("/jobs/" + jobId), HttpMethod.DELETE, HttpEntity.EMPTY, Void.class);
        } catch (ResourceAccessException | HttpStatusCodeException e) {
            log.warn("fetch job removal failed job_id={} error={}", jobId, e.getMessage());
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
