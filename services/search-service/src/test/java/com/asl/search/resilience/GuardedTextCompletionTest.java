package com.asl.search.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.asl.search.completion.CompletionUnavailableException;
import com.asl.search.completion.TextCompletion;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class GuardedTextCompletionTest {

    @Test
    void opensAfterConsecutiveFailures() {
        AtomicInteger calls = new AtomicInteger();
        TextCompletion failing = (prompt, options) -> {
            calls.incrementAndGet();
            throw new CompletionUnavailableException("down");
        };
        CircuitBreaker breaker = new CircuitBreaker("completion", 2, 60000);
        GuardedTextCompletion guarded = new GuardedTextCompletion(failing, breaker);

        assertThrows(CompletionUnavailableException.class, () -> guarded.complete("p", null));
        assertThrows(CompletionUnavailableException.class, () -> guarded.complete("p", null));
        CompletionUnavailableException open = assertThrows(CompletionUnavailableException.class,
            () -> guarded.complete("p", null));

        assertThat(open.getMessage()).isEqualTo("completion_circuit_open");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(breaker.isOpen()).isTrue();
    }

    @Test
    void successResetsFailureCount() {
        AtomicInteger calls = new AtomicInteger();
        TextCompletion flaky = (prompt, options) -> {
            if (calls.incrementAndGet() % 2 == 1) {
                throw new CompletionUnavailableException("down");
            }
            return "ok";
        };
        CircuitBreaker breaker = new CircuitBreaker("completion", 2, 60000);
        GuardedTextCompletion guarded = new GuardedTextCompletion(flaky, breaker);

        for (int i = 0; i < 3; i++) {
            assertThrows(CompletionUnavailableException.class, () -> guarded.complete("p", null));
            assertThat(guarded.complete("p", null)).isEqualTo("ok");
        }
        assertThat(breaker.isOpen()).isFalse();
    }
}
