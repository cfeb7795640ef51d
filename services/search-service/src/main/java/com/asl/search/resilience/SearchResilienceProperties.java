package com.asl.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private int completionFailureThreshold = 5;
    private long completionOpenMs = 30000;
    private int providerFailureThreshold = 5;
    private long providerOpenMs = 15000;

    public int getCompletionFailureThreshold() {
        return completionFailureThreshold;
    }

    public void setCompletionFailureThreshold(int completionFailureThreshold) {
        this.completionFailureThreshold = completionFailureThreshold;
    }

    public long getCompletionOpenMs() {
        return completionOpenMs;
    }

    public void setCompletionOpenMs(long completionOpenMs) {
        this.completionOpenMs = completionOpenMs;
    }

    public int getProviderFailureThreshold() {
        return providerFailureThreshold;
    }

    public void setProviderFailureThreshold(int providerFailureThreshold) {
        this.providerFailureThreshold = providerFailureThreshold;
    }

    public long getProviderOpenMs() {
        return providerOpenMs;
    }

    public void setProviderOpenMs(long providerOpenMs) {
        this.providerOpenMs = providerOpenMs;
    }
}
