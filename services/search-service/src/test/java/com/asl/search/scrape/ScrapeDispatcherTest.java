package com.asl.search.scrape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.api.dto.NewsResult;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.api.dto.WebResult;
import com.asl.search.policy.TeamFlags;
import com.asl.search.retrieval.ResultSet;
import com.asl.search.scrape.dto.FetchSpec;
import com.asl.search.scrape.dto.ScrapedDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ScrapeDispatcherTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void oneFailedFetchDoesNotFailTheBatch() {
        FakeQueue queue = new FakeQueue();
        queue.failingUrl = "https://c.example";
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(5000), executor);

        Map<ResultCategory, List<EnrichedResult>> results = dispatcher.dispatchSync(webResults(5), context(10000));

        List<EnrichedResult> web = results.get(ResultCategory.WEB);
        assertThat(web).hasSize(5);
        assertThat(web).filteredOn(EnrichedResult::isFailed).hasSize(1);
        EnrichedResult failed = web.get(2);
        assertThat(failed.isFailed()).isTrue();
        assertThat(failed.getItem().getUrl()).isEqualTo("https://c.example");
        assertThat(failed.getMetadata()).containsEntry("statusCode", 500);
        assertThat(failed.getCostTracking()).isEmpty();
        assertThat(web).filteredOn(r -> !r.isFailed()).allMatch(r -> "# page".equals(r.getMarkdown()));
        assertThat(queue.removed).hasSize(4);
    }

    @Test
    void fetchedFieldsOverrideButOriginalFieldsSurvive() {
        FakeQueue queue = new FakeQueue();
        queue.fetchedTitle = "Fetched title";
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(5000), executor);

        Map<ResultCategory, List<EnrichedResult>> results = dispatcher.dispatchSync(webResults(1), context(10000));

        EnrichedResult result = results.get(ResultCategory.WEB).get(0);
        WebResult item = (WebResult) result.getItem();
        assertThat(item.getTitle()).isEqualTo("Fetched title");
        assertThat(item.getDescription()).isEqualTo("snippet 0");
        assertThat(item.getUrl()).isEqualTo("https://a.example");
        assertThat(item.getPosition()).isEqualTo(1);
        assertThat(result.isFetched()).isTrue();
    }

    @Test
    void everyCategoryIsDispatched() {
        FakeQueue queue = new FakeQueue();
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(5000), executor);
        ResultSet eligible = new ResultSet(
            List.of(new WebResult("https://a.example", "a", "a", 1)),
            List.of(),
            List.of(new NewsResult("https://news.example", "n", "n", 1))
        );

        Map<ResultCategory, List<EnrichedResult>> results = dispatcher.dispatchSync(eligible, context(10000));

        assertThat(results.get(ResultCategory.WEB)).hasSize(1);
        assertThat(results.get(ResultCategory.IMAGES)).isEmpty();
        assertThat(results.get(ResultCategory.NEWS)).hasSize(1);
        assertThat(queue.submitted).hasSize(2);
    }

    @Test
    void slowJobTimesOutAloneAndKeepsTheRestOfTheBatch() {
        FakeQueue queue = new FakeQueue();
        queue.slowUrl = "https://d.example";
        queue.slowSubmitMs = 1500;
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(200), executor);

        Map<ResultCategory, List<EnrichedResult>> results = dispatcher.dispatchSync(webResults(5), context(200));

        List<EnrichedResult> web = results.get(ResultCategory.WEB);
        assertThat(web).hasSize(5);
        assertThat(web).filteredOn(EnrichedResult::isFailed).hasSize(1);
        EnrichedResult slow = web.get(3);
        assertThat(slow.isFailed()).isTrue();
        assertThat(slow.getItem().getUrl()).isEqualTo("https://d.example");
        assertThat(slow.getMetadata()).containsEntry("error", "Scrape job timed out after 400ms");
        assertThat(web).filteredOn(r -> !r.isFailed()).allMatch(r -> "# page".equals(r.getMarkdown()));
    }

    @Test
    void asyncModeReturnsHandlesWithoutWaiting() {
        FakeQueue queue = new FakeQueue();
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(5000), executor);

        Map<ResultCategory, List<ScrapeJobHandle>> handles = dispatcher.dispatchAsync(webResults(3), context(10000));

        assertThat(handles.get(ResultCategory.WEB)).hasSize(3);
        assertThat(handles.get(ResultCategory.WEB)).extracting(ScrapeJobHandle::getUrl)
            .containsExactly("https://a.example", "https://b.example", "https://c.example");
        assertThat(queue.awaitCalls.get()).isZero();
        assertThat(queue.submitted).allMatch(spec -> !spec.isBypassBilling());
    }

    @Test
    void asyncSubmitFailureOnlyDropsThatItemsHandle() {
        FakeQueue queue = new FakeQueue();
        queue.rejectedUrl = "https://b.example";
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(5000), executor);

        Map<ResultCategory, List<ScrapeJobHandle>> handles = dispatcher.dispatchAsync(webResults(3), context(10000));

        assertThat(handles.get(ResultCategory.WEB)).extracting(ScrapeJobHandle::getUrl)
            .containsExactly("https://a.example", "https://c.example");
        assertThat(queue.submitted).hasSize(2);
    }

    @Test
    void asyncFailsWhenNoJobCouldBeQueued() {
        FakeQueue queue = new FakeQueue();
        queue.rejectSubmit = true;
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(queue, properties(5000), executor);

        assertThrows(FetchQueueUnavailableException.class, () -> dispatcher.dispatchAsync(webResults(2), context(10000)));
    }

    @Test
    void asyncWithNothingEligibleReturnsEmptyHandles() {
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(new FakeQueue(), properties(5000), executor);

        Map<ResultCategory, List<ScrapeJobHandle>> handles = dispatcher.dispatchAsync(ResultSet.empty(), context(10000));

        assertThat(handles.get(ResultCategory.WEB)).isEmpty();
    }

    @Test
    void fetchSpecCarriesRequestContext() {
        TeamFlags flags = new TeamFlags();
        flags.setForceZdr(true);
        ScrapeContext context = new ScrapeContext("team-1", "api", 30000, Map.of("formats", List.of("markdown")), 42L,
            flags);
        ScrapeDispatcher dispatcher = new ScrapeDispatcher(new FakeQueue(), properties(5000), executor);

        FetchSpec spec = dispatcher.buildSpec(new WebResult("https://a.example", "a", "a", 1), context, false);

        assertThat(spec.getUrl()).isEqualTo("https://a.example");
        assertThat(spec.getTeamId()).isEqualTo("team-1");
        assertThat(spec.getOrigin()).isEqualTo("api");
        assertThat(spec.getScrapeOptions()).containsKey("formats");
        assertThat(spec.isBypassBilling()).isTrue();
        assertThat(spec.isZeroDataRetention()).isTrue();
        assertThat(spec.getApiKeyId()).isEqualTo(42L);
        assertThat(spec.getPriority()).isEqualTo(10);
        assertThat(spec.getMaxAgeMs()).isEqualTo(3L * 24 * 60 * 60 * 1000);
        assertThat(spec.getForceEngine()).isEqualTo("fire-engine;tlsclient");
        assertThat(spec.isDirectToQueue()).isTrue();
    }

    private static ResultSet webResults(int count) {
        List<WebResult> web = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            web.add(new WebResult("https://" + (char) ('a' + i) + ".example", "title " + i, "snippet " + i, i + 1));
        }
        return new ResultSet(web, List.of(), List.of());
    }

    private static ScrapeContext context(long timeoutMs) {
        return new ScrapeContext("team-1", "api", timeoutMs, Map.of(), null, TeamFlags.none());
    }

    private static ScrapeProperties properties(long joinGraceMs) {
        ScrapeProperties properties = new ScrapeProperties();
        properties.setJoinGraceMs(joinGraceMs);
        return properties;
    }

    private static class FakeQueue implements FetchJobQueue {
        private final List<FetchSpec> submitted = new CopyOnWriteArrayList<>();
        private final Map<String, String> urlsByJob = new ConcurrentHashMap<>();
        private final List<String> removed = new CopyOnWriteArrayList<>();
        private final AtomicInteger ids = new AtomicInteger();
        private final AtomicInteger awaitCalls = new AtomicInteger();
        private volatile String failingUrl;
        private volatile String fetchedTitle;
        private volatile boolean rejectSubmit;
        private volatile String rejectedUrl;
        private volatile String slowUrl;
        private volatile long slowSubmitMs;

        @Override
        public String submit(FetchSpec spec) {
            if (rejectSubmit || spec.getUrl().equals(rejectedUrl)) {
                throw new FetchQueueUnavailableException("queue down");
            }
            if (spec.getUrl().equals(slowUrl)) {
                sleep(slowSubmitMs);
            }
            submitted.add(spec);
            String jobId = "job-" + ids.incrementAndGet();
            urlsByJob.put(jobId, spec.getUrl());
            return jobId;
        }

        @Override
        public ScrapedDocument await(String jobId, long timeoutMs) {
            awaitCalls.incrementAndGet();
            String url = urlsByJob.get(jobId);
            if (url.equals(failingUrl)) {
                throw new ScrapeJobTimeoutException("Scrape job " + jobId + " timed out");
            }
            ScrapedDocument document = new ScrapedDocument();
            document.setUrl(url);
            document.setTitle(fetchedTitle);
            document.setMarkdown("# page");
            return document;
        }

        @Override
        public void remove(String jobId) {
            removed.add(jobId);
        }

        private static void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
