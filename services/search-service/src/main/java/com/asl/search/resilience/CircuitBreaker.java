package com.asl.search.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consecutive-failure breaker shared by every request that calls the same collaborator.
 */
public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
    }

    public boolean allowRequest() {
        return System.currentTimeMillis() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public void recordFailure() {
        if (consecutiveFailures.incrementAndGet() >= failureThreshold) {
            openUntilMs.set(System.currentTimeMillis() + openDurationMs);
            consecutiveFailures.set(0);
        }
    }

    public String getName() {
        return name;
    }
}
