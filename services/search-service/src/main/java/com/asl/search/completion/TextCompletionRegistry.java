package com.asl.search.completion;

import com.asl.search.resilience.CircuitBreaker;
import com.asl.search.resilience.GuardedTextCompletion;
import com.asl.search.resilience.SearchResilienceRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Named completion backends, resolved per request. Backends are built once at startup and
 * never swapped afterwards.
 */
@Component
public class TextCompletionRegistry {
    private final Map<String, TextCompletion> backends;
    private final String defaultBackend;

    @Autowired
    public TextCompletionRegistry(
        @Qualifier("completionRestTemplate") RestTemplate restTemplate,
        CompletionProperties properties,
        SearchResilienceRegistry resilienceRegistry
    ) {
        Map<String, TextCompletion> built = new LinkedHashMap<>();
        Map<String, CompletionProperties.Backend> configured = properties.getBackends();
        if (configured.isEmpty()) {
            configured = Map.of(properties.getDefaultBackend(), new CompletionProperties.Backend());
        }
        for (Map.Entry<String, CompletionProperties.Backend> entry : configured.entrySet()) {
            CompletionGateway gateway = new CompletionGateway(restTemplate, entry.getKey(), entry.getValue());
            CircuitBreaker breaker = resilienceRegistry.getCompletionBreaker(entry.getKey());
            built.put(entry.getKey(), new GuardedTextCompletion(gateway, breaker));
        }
        this.backends = Map.copyOf(built);
        this.defaultBackend = backends.containsKey(properties.getDefaultBackend())
            ? properties.getDefaultBackend()
            : configured.keySet().iterator().next();
    }

    public TextCompletionRegistry(Map<String, TextCompletion> backends, String defaultBackend) {
        this.backends = Map.copyOf(backends);
        this.defaultBackend = defaultBackend;
    }

    public boolean contains(String name) {
        return name != null && backends.containsKey(name);
    }

    public TextCompletion resolve(String name) {
        if (name == null || name.isBlank()) {
            return backends.get(defaultBackend);
        }
        TextCompletion completion = backends.get(name);
        if (completion == null) {
            throw new IllegalArgumentException("Unknown completion backend: " + name);
        }
        return completion;
    }

    public String getDefaultBackend() {
        return defaultBackend;
    }
}
