package com.asl.search.service;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.api.dto.ImageResult;
import com.asl.search.api.dto.NewsResult;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.api.dto.SearchRequest;
import com.asl.search.api.dto.SearchResponse;
import com.asl.search.api.dto.SearchResultItem;
import com.asl.search.api.dto.WebResult;
import com.asl.search.audit.RequestLogSink;
import com.asl.search.audit.RequestSummary;
import com.asl.search.billing.BillingLedger;
import com.asl.search.billing.CreditCalculator;
import com.asl.search.category.CategoryLabeler;
import com.asl.search.category.CategoryMapBuilder;
import com.asl.search.category.CategoryRule;
import com.asl.search.completion.TextCompletion;
import com.asl.search.completion.TextCompletionRegistry;
import com.asl.search.evidence.AnswerEvaluator;
import com.asl.search.evidence.EvaluationVerdict;
import com.asl.search.evidence.EvidenceBundle;
import com.asl.search.evidence.SpanExtractor;
import com.asl.search.execution.DetachedTaskRunner;
import com.asl.search.merge.FinalReranker;
import com.asl.search.merge.FusionProperties;
import com.asl.search.merge.RankFusion;
import com.asl.search.policy.BlockedUrlFilter;
import com.asl.search.policy.TeamFlags;
import com.asl.search.policy.TeamPolicyService;
import com.asl.search.provider.dto.ProviderSearchRequest;
import com.asl.search.provider.dto.ProviderSearchResponse;
import com.asl.search.query.QueryExpander;
import com.asl.search.retrieval.ResultSet;
import com.asl.search.retrieval.SearchFanout;
import com.asl.search.retrieval.VariantSearchResult;
import com.asl.search.scrape.ScrapeContext;
import com.asl.search.scrape.ScrapeDispatcher;
import com.asl.search.scrape.ScrapeJobHandle;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives expand, search, fuse, label, limit, filter, dispatch, extract and evaluate passes
 * until the evaluator is satisfied or the iteration budget runs out.
 *
 * <p>Each pass works on its own data; only the gap hint and the latest pass's result set
 * carry over. The response is built from the last executed pass, never from a merge of
 * several passes.
 */
@Service
public class AgenticSearchService {
    private static final Logger log = LoggerFactory.getLogger(AgenticSearchService.class);
    private static final String GAP_HINT_SEPARATOR = "; ";

    private final SearchRequestValidator validator;
    private final TeamPolicyService teamPolicyService;
    private final TextCompletionRegistry completionRegistry;
    private final QueryExpander queryExpander;
    private final SearchFanout searchFanout;
    private final FusionProperties fusionProperties;
    private final BlockedUrlFilter blockedUrlFilter;
    private final ScrapeDispatcher scrapeDispatcher;
    private final SpanExtractor spanExtractor;
    private final AnswerEvaluator answerEvaluator;
    private final CreditCalculator creditCalculator;
    private final BillingLedger billingLedger;
    private final RequestLogSink requestLogSink;
    private final DetachedTaskRunner detachedTaskRunner;
    private final SearchLoopProperties loopProperties;
    private final MeterRegistry meterRegistry;

    public AgenticSearchService(
        SearchRequestValidator validator,
        TeamPolicyService teamPolicyService,
        TextCompletionRegistry completionRegistry,
        QueryExpander queryExpander,
        SearchFanout searchFanout,
        FusionProperties fusionProperties,
        BlockedUrlFilter blockedUrlFilter,
        ScrapeDispatcher scrapeDispatcher,
        SpanExtractor spanExtractor,
        AnswerEvaluator answerEvaluator,
        CreditCalculator creditCalculator,
        BillingLedger billingLedger,
        RequestLogSink requestLogSink,
        DetachedTaskRunner detachedTaskRunner,
        SearchLoopProperties loopProperties,
        MeterRegistry meterRegistry
    ) {
        this.validator = validator;
        this.teamPolicyService = teamPolicyService;
        this.completionRegistry = completionRegistry;
        this.queryExpander = queryExpander;
        this.searchFanout = searchFanout;
        this.fusionProperties = fusionProperties;
        this.blockedUrlFilter = blockedUrlFilter;
        this.scrapeDispatcher = scrapeDispatcher;
        this.spanExtractor = spanExtractor;
        this.answerEvaluator = answerEvaluator;
        this.creditCalculator = creditCalculator;
        this.billingLedger = billingLedger;
        this.requestLogSink = requestLogSink;
        this.detachedTaskRunner = detachedTaskRunner;
        this.loopProperties = loopProperties;
        this.meterRegistry = meterRegistry;
    }

    public SearchResponse search(SearchRequest request, String teamId, Long apiKeyId, String requestId) {
        long started = System.nanoTime();
        meterRegistry.counter("search_requests_total").increment();

        SearchCommand command;
        TeamFlags flags;
        try {
            command = validator.validate(request, teamId, apiKeyId, requestId);
            flags = teamPolicyService.flagsFor(teamId);
            if (flags.isForceZdr()) {
                throw new ZeroDataRetentionUnsupportedException(teamId);
            }
        } catch (RuntimeException e) {
            long tookMs = elapsedMs(started);
            log.info("search rejected request_id={} team_id={} error={}", requestId, teamId, e.getMessage());
            recordSummary(rejectedCommand(request, teamId, apiKeyId, requestId), false, e.getMessage(), 0, 0, 0, tookMs);
            meterRegistry.timer("search_request_latency").record(tookMs, TimeUnit.MILLISECONDS);
            throw e;
        }

        int iterations = 0;
        try {
            TextCompletion completion = completionRegistry.resolve(command.getCompletionBackend());
            List<CategoryRule> rules = CategoryMapBuilder.build(command.getCategories());
            ProviderSearchRequest template = buildProviderRequest(command);
            ScrapeContext scrapeContext = new ScrapeContext(
                command.getTeamId(),
                command.getOrigin(),
                command.getTimeoutMs(),
                command.getScrapeOptions(),
                command.getApiKeyId(),
                flags
            );

            boolean enrich = loopProperties.isEnrichmentEnabled();
            // async dispatch leaves no fetched content to evaluate, so one pass is all it gets
            int maxIterations = enrich && !command.isAsyncScraping() ? Math.max(1, loopProperties.getMaxIterations()) : 1;
            long deadline = loopProperties.getRequestDeadlineMs() > 0
                ? System.currentTimeMillis() + loopProperties.getRequestDeadlineMs()
                : Long.MAX_VALUE;

            IterationState last = null;
            String gapHint = null;
            while (iterations < maxIterations) {
                if (iterations > 0 && System.currentTimeMillis() >= deadline) {
                    log.info("request deadline reached iterations={} request_id={}", iterations, requestId);
                    break;
                }
                iterations++;
                meterRegistry.counter("search_iterations_total").increment();
                last = runIteration(iterations, command, gapHint, rules, template, scrapeContext, completion, enrich);
                if (last.isConverged()) {
                    meterRegistry.counter("search_converged_total").increment();
                    break;
                }
                gapHint = last.getGapHint();
            }

            Map<ResultCategory, List<EnrichedResult>> results = new EnumMap<>(ResultCategory.class);
            results.putAll(last.getResults());
            results.put(ResultCategory.WEB, FinalReranker.rerank(last.getResults(ResultCategory.WEB), last.getVariants()));

            int credits = computeCredits(last, results, command, scrapeContext, enrich);
            if (!command.isPreview() && !command.isAsyncScraping() && credits > 0) {
                detachedTaskRunner.runDetached("bill_team",
                    () -> billingLedger.billTeam(command.getTeamId(), command.getApiKeyId(), credits));
            }

            SearchResponse response = buildResponse(command, results, last.getJobHandles(), credits, iterations);
            long tookMs = elapsedMs(started);
            recordSummary(command, true, null, response.getData().size(), credits, iterations, tookMs);
            meterRegistry.timer("search_request_latency").record(tookMs, TimeUnit.MILLISECONDS);
            log.info("search completed request_id={} team_id={} iterations={} results={} credits={} took_ms={}",
                requestId, teamId, iterations, response.getData().size(), credits, tookMs);
            return response;
        } catch (RuntimeException e) {
            long tookMs = elapsedMs(started);
            recordSummary(command, false, e.getMessage(), 0, 0, iterations, tookMs);
            meterRegistry.timer("search_request_latency").record(tookMs, TimeUnit.MILLISECONDS);
            throw e;
        }
    }

    private IterationState runIteration(
        int index,
        SearchCommand command,
        String gapHint,
        List<CategoryRule> rules,
        ProviderSearchRequest template,
        ScrapeContext scrapeContext,
        TextCompletion completion,
        boolean enrich
    ) {
        List<String> variants = queryExpander.expand(command.getQuery(), gapHint, loopProperties.getMaxVariants(),
            completion);
        List<VariantSearchResult> searched = searchFanout.searchAll(variants, template);

        List<WebResult> web = prepare(ResultCategory.WEB, command, searched, ProviderSearchResponse::getWeb,
            variants, rules);
        List<ImageResult> images = prepare(ResultCategory.IMAGES, command, searched,
            ProviderSearchResponse::getImages, variants, null);
        List<NewsResult> news = prepare(ResultCategory.NEWS, command, searched, ProviderSearchResponse::getNews,
            variants, rules);

        BlockedUrlFilter.Filtered<WebResult> allowedWeb = blockedUrlFilter.filter(web, scrapeContext.getFlags());
        BlockedUrlFilter.Filtered<ImageResult> allowedImages = blockedUrlFilter.filter(images, scrapeContext.getFlags());
        BlockedUrlFilter.Filtered<NewsResult> allowedNews = blockedUrlFilter.filter(news, scrapeContext.getFlags());
        int blocked = allowedWeb.getBlockedCount() + allowedImages.getBlockedCount() + allowedNews.getBlockedCount();
        if (blocked > 0) {
            meterRegistry.counter("search_blocked_urls_total").increment(blocked);
        }
        ResultSet eligible = new ResultSet(allowedWeb.getItems(), allowedImages.getItems(), allowedNews.getItems());

        if (!enrich) {
            return new IterationState(index, variants, unfetched(eligible), null, blocked, null, false, null);
        }

        if (command.isAsyncScraping()) {
            log.info("dispatching scrape jobs mode=async urls={} request_id={}", eligible.size(),
                command.getRequestId());
            Map<ResultCategory, List<ScrapeJobHandle>> handles = scrapeDispatcher.dispatchAsync(eligible, scrapeContext);
            return new IterationState(index, variants, unfetched(eligible), handles, blocked, null, false, null);
        }

        log.info("dispatching scrape jobs mode=sync urls={} request_id={}", eligible.size(), command.getRequestId());
        Map<ResultCategory, List<EnrichedResult>> results = scrapeDispatcher.dispatchSync(eligible, scrapeContext);
        int failures = countFailures(results);
        if (failures > 0) {
            meterRegistry.counter("search_scrape_failures_total").increment(failures);
        }

        EvidenceBundle evidence = spanExtractor.collect(results.get(ResultCategory.WEB), command.getQuery(),
            loopProperties.getMaxSpans());
        EvaluationVerdict verdict = answerEvaluator.evaluate(command.getQuery(), evidence, completion);
        boolean converged = verdict.isConverged(loopProperties.getConvergenceThreshold());
        String nextGapHint = converged ? null : gapHintFrom(verdict);
        log.info("iteration evaluated iteration={} answered={} confidence={} gap_hint={} request_id={}",
            index, verdict.isAnswered(), verdict.getConfidence(), nextGapHint != null, command.getRequestId());
        return new IterationState(index, variants, results, null, blocked, verdict, converged, nextGapHint);
    }

    private <T extends SearchResultItem> List<T> prepare(
        ResultCategory category,
        SearchCommand command,
        List<VariantSearchResult> searched,
        Function<ProviderSearchResponse, List<T>> extractor,
        List<String> variants,
        List<CategoryRule> rules
    ) {
        if (!command.getSources().contains(category)) {
            return new ArrayList<>();
        }
        List<List<T>> lists = new ArrayList<>(searched.size());
        for (VariantSearchResult result : searched) {
            List<T> items = extractor.apply(result.getResponse());
            lists.add(items == null ? List.of() : items);
        }
        List<T> fused = RankFusion.toItems(
            RankFusion.fuse(lists, variants, fusionProperties.getK(), fusionProperties.getBeta())
        );
        if (rules != null) {
            fused = CategoryLabeler.labelAll(fused, rules);
        }
        return ResultLimiter.limit(fused, command.getLimit());
    }

    private String gapHintFrom(EvaluationVerdict verdict) {
        List<String> facts = verdict.getMissingFacts();
        if (facts.isEmpty()) {
            return null;
        }
        int count = Math.min(facts.size(), Math.max(1, loopProperties.getMaxGapFacts()));
        return String.join(GAP_HINT_SEPARATOR, facts.subList(0, count));
    }

    private int computeCredits(
        IterationState last,
        Map<ResultCategory, List<EnrichedResult>> results,
        SearchCommand command,
        ScrapeContext scrapeContext,
        boolean enrich
    ) {
        if (!enrich) {
            return last.resultCount();
        }
        if (command.isAsyncScraping()) {
            return last.jobCount();
        }
        try {
            int credits = 0;
            for (List<EnrichedResult> list : results.values()) {
                for (EnrichedResult result : list) {
                    if (result.isFetched() && !result.isFailed()) {
                        credits += creditCalculator.creditsFor(result, scrapeContext);
                    }
                }
            }
            return credits;
        } catch (RuntimeException e) {
            log.error("credit calculation failed; billing result count request_id={}", command.getRequestId(), e);
            return last.resultCount();
        }
    }

    private SearchResponse buildResponse(
        SearchCommand command,
        Map<ResultCategory, List<EnrichedResult>> results,
        Map<ResultCategory, List<ScrapeJobHandle>> handles,
        int credits,
        int iterations
    ) {
        SearchResponse.Data data = new SearchResponse.Data();
        data.setWeb(results.get(ResultCategory.WEB));
        data.setImages(results.get(ResultCategory.IMAGES));
        data.setNews(results.get(ResultCategory.NEWS));

        SearchResponse response = new SearchResponse();
        response.setSuccess(true);
        response.setData(data);
        if (handles != null) {
            SearchResponse.ScrapeIds scrapeIds = new SearchResponse.ScrapeIds();
            scrapeIds.setWeb(jobIds(handles.get(ResultCategory.WEB)));
            scrapeIds.setImages(jobIds(handles.get(ResultCategory.IMAGES)));
            scrapeIds.setNews(jobIds(handles.get(ResultCategory.NEWS)));
            response.setScrapeIds(scrapeIds);
        }
        response.setCreditsUsed(credits);
        response.setIterations(iterations);
        response.setRequestId(command.getRequestId());
        return response;
    }

    private void recordSummary(
        SearchCommand command,
        boolean success,
        String error,
        int numDocs,
        int credits,
        int iterations,
        long tookMs
    ) {
        RequestSummary summary = new RequestSummary();
        summary.setJobId(command.getRequestId());
        summary.setSuccess(success);
        summary.setError(error);
        summary.setNumDocs(numDocs);
        summary.setTimeTakenSeconds(tookMs / 1000.0);
        summary.setTeamId(command.getTeamId());
        summary.setQuery(command.getQuery());
        summary.setScrapeOptions(command.getScrapeOptions());
        summary.setOrigin(command.getOrigin());
        summary.setIntegration(command.getIntegration());
        summary.setCreditsBilled(credits);
        summary.setIterations(iterations);
        summary.setAsyncScraping(command.isAsyncScraping());
        detachedTaskRunner.runDetached("record_request", () -> requestLogSink.record(summary));
    }

    // carries what the raw request offers when validation never produced a command
    private static SearchCommand rejectedCommand(SearchRequest request, String teamId, Long apiKeyId, String requestId) {
        SearchCommand command = new SearchCommand();
        command.setRequestId(requestId);
        command.setTeamId(teamId);
        command.setApiKeyId(apiKeyId);
        if (request != null) {
            command.setQuery(request.getQuery());
            command.setIntegration(request.getIntegration());
            command.setScrapeOptions(request.getScrapeOptions());
            command.setAsyncScraping(Boolean.TRUE.equals(request.getAsyncScraping()));
        }
        String origin = request == null ? null : request.getOrigin();
        command.setOrigin(origin == null || origin.isBlank() ? "api" : origin);
        return command;
    }

    private ProviderSearchRequest buildProviderRequest(SearchCommand command) {
        ProviderSearchRequest template = new ProviderSearchRequest();
        template.setQuery(command.getQuery());
        template.setNumResults(command.getLimit() * Math.max(1, loopProperties.getResultBufferFactor()));
        List<String> types = new ArrayList<>();
        for (ResultCategory source : command.getSources()) {
            types.add(source.getKey());
        }
        template.setTypes(types);
        template.setTbs(command.getTbs());
        template.setFilter(command.getFilter());
        template.setLang(command.getLang());
        template.setCountry(command.getCountry());
        template.setLocation(command.getLocation());
        return template;
    }

    private static Map<ResultCategory, List<EnrichedResult>> unfetched(ResultSet eligible) {
        Map<ResultCategory, List<EnrichedResult>> results = new EnumMap<>(ResultCategory.class);
        for (ResultCategory category : ResultCategory.values()) {
            List<EnrichedResult> list = new ArrayList<>();
            for (SearchResultItem item : eligible.get(category)) {
                list.add(EnrichedResult.unfetched(item));
            }
            results.put(category, list);
        }
        return results;
    }

    private static int countFailures(Map<ResultCategory, List<EnrichedResult>> results) {
        int failures = 0;
        for (List<EnrichedResult> list : results.values()) {
            for (EnrichedResult result : list) {
                if (result.isFailed()) {
                    failures++;
                }
            }
        }
        return failures;
    }

    private static List<String> jobIds(List<ScrapeJobHandle> handles) {
        List<String> ids = new ArrayList<>();
        if (handles != null) {
            for (ScrapeJobHandle handle : handles) {
                ids.add(handle.getJobId());
            }
        }
        return ids;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
