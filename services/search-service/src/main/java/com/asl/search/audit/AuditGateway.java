package com.asl.search.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Ships request summaries to the audit store. Delivery is best effort.
 */
@Component
public class AuditGateway implements RequestLogSink {
    private static final Logger log = LoggerFactory.getLogger(AuditGateway.class);

    private final RestTemplate restTemplate;
    private final AuditProperties properties;

    public AuditGateway(@Qualifier("auditRestTemplate") RestTemplate restTemplate, AuditProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public void record(RequestSummary summary) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.exchange(buildUrl("/requests"), HttpMethod.POST, new HttpEntity<>(summary, headers), Void.class);
        } catch (RestClientException e) {
            log.warn("request summary not recorded job_id={} error={}", summary.getJobId(), e.getMessage());
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
