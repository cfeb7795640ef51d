package com.asl.search.resilience;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Breakers shared across requests. Each completion backend trips on its own failures only.
 */
@Component
public class SearchResilienceRegistry {
    private final SearchResilienceProperties properties;
    private final Map<String, CircuitBreaker> completionBreakers = new ConcurrentHashMap<>();
    private final CircuitBreaker providerBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.properties = properties;
        this.providerBreaker = new CircuitBreaker(
            "search_provider",
            properties.getProviderFailureThreshold(),
            properties.getProviderOpenMs()
        );
    }

    public CircuitBreaker getCompletionBreaker(String backend) {
        return completionBreakers.computeIfAbsent(backend, name -> new CircuitBreaker(
            "completion_" + name,
            properties.getCompletionFailureThreshold(),
            properties.getCompletionOpenMs()
        ));
    }

    public CircuitBreaker getProviderBreaker() {
        return providerBreaker;
    }

    public SearchResilienceProperties getProperties() {
        return properties;
    }
}
