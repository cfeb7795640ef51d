package com.asl.search.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs side effects (billing, request logging) off the request path. Failures are logged
 * and never reach the caller.
 */
@Component
public class DetachedTaskRunner {
    private static final Logger log = LoggerFactory.getLogger(DetachedTaskRunner.class);

    private final ExecutorService backgroundExecutor;

    public DetachedTaskRunner(@Qualifier("backgroundExecutor") ExecutorService backgroundExecutor) {
        this.backgroundExecutor = backgroundExecutor;
    }

    public CompletableFuture<Void> runDetached(String name, Runnable task) {
        try {
            return CompletableFuture.runAsync(task, backgroundExecutor)
                .exceptionally(e -> {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("detached task failed task={} error={}", name, cause.getMessage(), cause);
                    return null;
                });
        } catch (RejectedExecutionException e) {
            log.error("detached task rejected task={}", name, e);
            return CompletableFuture.completedFuture(null);
        }
    }
}
