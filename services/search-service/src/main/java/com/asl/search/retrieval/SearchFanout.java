package com.asl.search.retrieval;

import com.asl.search.provider.SearchProvider;
import com.asl.search.provider.SearchProviderUnavailableException;
import com.asl.search.provider.dto.ProviderSearchRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * One provider call per query variant, all in flight at once. The join waits for every
 * call to settle; a failed variant contributes an empty result.
 */
@Component
public class SearchFanout {
    private static final Logger log = LoggerFactory.getLogger(SearchFanout.class);

    private final SearchProvider searchProvider;
    private final ExecutorService searchExecutor;

    public SearchFanout(SearchProvider searchProvider, @Qualifier("searchExecutor") ExecutorService searchExecutor) {
        this.searchProvider = searchProvider;
        this.searchExecutor = searchExecutor;
    }

    public List<VariantSearchResult> searchAll(List<String> variants, ProviderSearchRequest template) {
        List<CompletableFuture<VariantSearchResult>> futures = new ArrayList<>(variants.size());
        for (String variant : variants) {
            futures.add(
                CompletableFuture.supplyAsync(() -> searchOne(variant, template), searchExecutor)
                    .exceptionally(e -> VariantSearchResult.error(variant, errorMessage(e)))
            );
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<VariantSearchResult> results = new ArrayList<>(futures.size());
        int failures = 0;
        for (CompletableFuture<VariantSearchResult> future : futures) {
            VariantSearchResult result = future.join();
            if (result.isError()) {
                failures++;
                log.warn("variant search failed query={} error={}", result.getQuery(), result.getErrorMessage());
            }
            results.add(result);
        }
        if (!results.isEmpty() && failures == results.size()) {
            throw new SearchProviderUnavailableException("All " + failures + " variant searches failed");
        }
        return results;
    }

    private VariantSearchResult searchOne(String variant, ProviderSearchRequest template) {
        long started = System.nanoTime();
        return VariantSearchResult.success(
            variant,
            searchProvider.search(template.forQuery(variant)),
            (System.nanoTime() - started) / 1_000_000L
        );
    }

    private String errorMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
