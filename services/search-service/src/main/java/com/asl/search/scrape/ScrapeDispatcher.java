package com.asl.search.scrape;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.api.dto.SearchResultItem;
import com.asl.search.retrieval.ResultSet;
import com.asl.search.scrape.dto.FetchSpec;
import com.asl.search.scrape.dto.ScrapedDocument;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Submits one fetch job per eligible URL, all concurrently.
 *
 * <p>Sync mode gives every job its own time budget and turns each failure or overrun into
 * an error item, so one bad URL never fails the batch. Async mode returns the handles of
 * the jobs that were queued; completion and billing then belong to the queue.
 */
@Component
public class ScrapeDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ScrapeDispatcher.class);

    private final FetchJobQueue queue;
    private final ScrapeProperties properties;
    private final ExecutorService scrapeExecutor;

    public ScrapeDispatcher(
        FetchJobQueue queue,
        ScrapeProperties properties,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor
    ) {
        this.queue = queue;
        this.properties = properties;
        this.scrapeExecutor = scrapeExecutor;
    }

    public Map<ResultCategory, List<EnrichedResult>> dispatchSync(ResultSet eligible, ScrapeContext context) {
        long itemBudgetMs = context.getTimeoutMs() + properties.getJoinGraceMs();
        Map<ResultCategory, List<CompletableFuture<EnrichedResult>>> futures = new EnumMap<>(ResultCategory.class);
        for (ResultCategory category : ResultCategory.values()) {
            List<CompletableFuture<EnrichedResult>> perCategory = new ArrayList<>();
            for (SearchResultItem item : eligible.get(category)) {
                perCategory.add(CompletableFuture
                    .supplyAsync(() -> scrapeOne(item, context), scrapeExecutor)
                    .orTimeout(itemBudgetMs, TimeUnit.MILLISECONDS)
                    .exceptionally(e -> failedItem(item, context, e, itemBudgetMs)));
            }
            futures.put(category, perCategory);
        }

        // every future completes by itself within its budget, so joining cannot hang
        Map<ResultCategory, List<EnrichedResult>> results = new EnumMap<>(ResultCategory.class);
        for (Map.Entry<ResultCategory, List<CompletableFuture<EnrichedResult>>> entry : futures.entrySet()) {
            List<EnrichedResult> enriched = new ArrayList<>(entry.getValue().size());
            for (CompletableFuture<EnrichedResult> future : entry.getValue()) {
                enriched.add(future.join());
            }
            results.put(entry.getKey(), enriched);
        }
        return results;
    }

    /**
     * Items whose job could not be queued get no handle. Fails only when no job at all
     * could be queued.
     */
    public Map<ResultCategory, List<ScrapeJobHandle>> dispatchAsync(ResultSet eligible, ScrapeContext context) {
        Map<ResultCategory, List<CompletableFuture<ScrapeJobHandle>>> futures = new EnumMap<>(ResultCategory.class);
        List<RuntimeException> failures = new CopyOnWriteArrayList<>();
        int total = 0;
        for (ResultCategory category : ResultCategory.values()) {
            List<CompletableFuture<ScrapeJobHandle>> perCategory = new ArrayList<>();
            for (SearchResultItem item : eligible.get(category)) {
                total++;
                perCategory.add(CompletableFuture
                    .supplyAsync(() -> submit(item, context, true), scrapeExecutor)
                    .exceptionally(e -> {
                        RuntimeException cause = unwrap(e);
                        log.warn("scrape job submission failed url={} team_id={} error={}", item.getUrl(),
                            context.getTeamId(), errorMessage(cause));
                        failures.add(cause);
                        return null;
                    }));
            }
            futures.put(category, perCategory);
        }

        Map<ResultCategory, List<ScrapeJobHandle>> handles = new EnumMap<>(ResultCategory.class);
        for (Map.Entry<ResultCategory, List<CompletableFuture<ScrapeJobHandle>>> entry : futures.entrySet()) {
            List<ScrapeJobHandle> perCategory = new ArrayList<>(entry.getValue().size());
            for (CompletableFuture<ScrapeJobHandle> future : entry.getValue()) {
                ScrapeJobHandle handle = future.join();
                if (handle != null) {
                    perCategory.add(handle);
                }
            }
            handles.put(entry.getKey(), perCategory);
        }
        if (total > 0 && failures.size() == total) {
            throw failures.get(0);
        }
        return handles;
    }

    private EnrichedResult scrapeOne(SearchResultItem item, ScrapeContext context) {
        try {
            ScrapeJobHandle handle = submit(item, context, false);
            ScrapedDocument document = handle.await(context.getTimeoutMs());
            log.info("scrape job completed job_id={} url={} team_id={}", handle.getJobId(), item.getUrl(),
                context.getTeamId());
            handle.remove();
            return EnrichedResult.fetched(item, document);
        } catch (RuntimeException e) {
            log.error("scrape failed url={} team_id={} error={}", item.getUrl(), context.getTeamId(), e.getMessage());
            return EnrichedResult.failed(item, errorMessage(e));
        }
    }

    private ScrapeJobHandle submit(SearchResultItem item, ScrapeContext context, boolean async) {
        FetchSpec spec = buildSpec(item, context, async);
        String jobId = queue.submit(spec);
        log.info("scrape job submitted job_id={} url={} team_id={} origin={} zdr={}", jobId, item.getUrl(),
            context.getTeamId(), context.getOrigin(), spec.isZeroDataRetention());
        return new ScrapeJobHandle(jobId, item.getUrl(), item.getType(), queue);
    }

    FetchSpec buildSpec(SearchResultItem item, ScrapeContext context, boolean async) {
        FetchSpec spec = new FetchSpec();
        spec.setUrl(item.getUrl());
        spec.setTeamId(context.getTeamId());
        spec.setOrigin(context.getOrigin());
        spec.setScrapeOptions(context.getScrapeOptions());
        spec.setMaxAgeMs(properties.getMaxAgeMs());
        spec.setForceEngine(properties.getForceEngine());
        // async jobs bill themselves on completion; sync results are billed by the request
        spec.setBypassBilling(!async);
        spec.setZeroDataRetention(context.getFlags().isForceZdr());
        spec.setApiKeyId(context.getApiKeyId());
        spec.setPriority(properties.getBasePriority());
        spec.setDirectToQueue(true);
        spec.setStartTime(System.currentTimeMillis());
        return spec;
    }

    private EnrichedResult failedItem(SearchResultItem item, ScrapeContext context, Throwable e, long budgetMs) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            log.warn("scrape job exceeded its budget url={} team_id={} budget_ms={}", item.getUrl(),
                context.getTeamId(), budgetMs);
            return EnrichedResult.failed(item, "Scrape job timed out after " + budgetMs + "ms");
        }
        log.error("scrape failed url={} team_id={} error={}", item.getUrl(), context.getTeamId(), errorMessage(cause));
        return EnrichedResult.failed(item, errorMessage(cause));
    }

    private static RuntimeException unwrap(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause instanceof RuntimeException ? (RuntimeException) cause : new CompletionException(cause);
    }

    private String errorMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
