package com.asl.search.provider;

import com.asl.search.provider.dto.ProviderSearchRequest;
import com.asl.search.provider.dto.ProviderSearchResponse;
import com.asl.search.resilience.CircuitBreaker;
import com.asl.search.resilience.SearchResilienceRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class SearchProviderGateway implements SearchProvider {
    private final RestTemplate restTemplate;
    private final SearchProviderProperties properties;
    private final CircuitBreaker breaker;

    public SearchProviderGateway(
        @Qualifier("searchProviderRestTemplate") RestTemplate restTemplate,
        SearchProviderProperties properties,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.breaker = resilienceRegistry.getProviderBreaker();
    }

    @Override
    public ProviderSearchResponse search(ProviderSearchRequest request) {
        if (!breaker.allowRequest()) {
            throw new SearchProviderUnavailableException("search_provider_circuit_open");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<ProviderSearchResponse> response = restTemplate.exchange(
                buildUrl("/search"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                ProviderSearchResponse.class
            );
            breaker.recordSuccess();
            return response.getBody() == null ? ProviderSearchResponse.empty() : response.getBody();
        } catch (ResourceAccessException e) {
            breaker.recordFailure();
            throw new SearchProviderUnavailableException("Search provider unavailable", e);
        } catch (HttpStatusCodeException e) {
            breaker.recordFailure();
            throw new SearchProviderUnavailableException("Search provider error: " + e.getStatusCode(), e);
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
