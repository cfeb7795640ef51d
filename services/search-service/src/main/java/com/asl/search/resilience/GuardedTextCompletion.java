package com.asl.search.resilience;

import com.asl.search.completion.CompletionOptions;
import com.asl.search.completion.CompletionUnavailableException;
import com.asl.search.completion.TextCompletion;

public class GuardedTextCompletion implements TextCompletion {
    private final TextCompletion delegate;
    private final CircuitBreaker breaker;

    public GuardedTextCompletion(TextCompletion delegate, CircuitBreaker breaker) {
        this.delegate = delegate;
        this.breaker = breaker;
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        if (!breaker.allowRequest()) {
            throw new CompletionUnavailableException(breaker.getName() + "_circuit_open");
        }
        try {
            String text = delegate.complete(prompt, options);
            breaker.recordSuccess();
            return text;
        } catch (RuntimeException e) {
            breaker.recordFailure();
            throw e;
        }
    }
}
