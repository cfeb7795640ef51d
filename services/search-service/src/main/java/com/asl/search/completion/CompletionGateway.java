package com.asl.search.completion;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Calls one OpenAI-compatible chat completions endpoint.
 */
public class CompletionGateway implements TextCompletion {
    private final RestTemplate restTemplate;
    private final String name;
    private final CompletionProperties.Backend backend;

    public CompletionGateway(RestTemplate restTemplate, String name, CompletionProperties.Backend backend) {
        this.restTemplate = restTemplate;
        this.name = name;
        this.backend = backend;
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (backend.getApiKey() != null && !backend.getApiKey().isBlank()) {
            headers.setBearerAuth(backend.getApiKey());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", backend.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", options == null ? 0.0 : options.getTemperature());

        try {
            RestTemplate client = restTemplateFor(options == null ? null : options.getTimeoutMs());
            ResponseEntity<JsonNode> response = client.exchange(
                buildUrl("/v1/chat/completions"),
                HttpMethod.POST,
                new HttpEntity<>(body, headers),
                JsonNode.class
            );
            JsonNode content = response.getBody() == null
                ? null
                : response.getBody().path("choices").path(0).path("message").path("content");
            if (content == null || !content.isTextual()) {
                throw new CompletionUnavailableException("Completion backend " + name + " returned no content");
            }
            return content.asText();
        } catch (ResourceAccessException e) {
            throw new CompletionUnavailableException("Completion backend " + name + " unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new CompletionUnavailableException("Completion backend " + name + " error: " + e.getStatusCode(), e);
        }
    }

    public String getName() {
        return name;
    }

    private String buildUrl(String path) {
        String base = backend.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeoutMs) {
        if (timeoutMs == null || timeoutMs <= 0) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}
