package com.asl.search.service;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.api.dto.ResultCategory;
import com.asl.search.evidence.EvaluationVerdict;
import com.asl.search.scrape.ScrapeJobHandle;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one pass through the loop. Only the last one survives into the response.
 */
public class IterationState {
    private final int index;
    private final List<String> variants;
    private final Map<ResultCategory, List<EnrichedResult>> results;
    private final Map<ResultCategory, List<ScrapeJobHandle>> jobHandles;
    private final int blockedCount;
    private final EvaluationVerdict verdict;
    private final boolean converged;
    private final String gapHint;

    public IterationState(
        int index,
        List<String> variants,
        Map<ResultCategory, List<EnrichedResult>> results,
        Map<ResultCategory, List<ScrapeJobHandle>> jobHandles,
        int blockedCount,
        EvaluationVerdict verdict,
        boolean converged,
        String gapHint
    ) {
        this.index = index;
        this.variants = variants;
        this.results = results == null ? new EnumMap<>(ResultCategory.class) : results;
        this.jobHandles = jobHandles;
        this.blockedCount = blockedCount;
        this.verdict = verdict;
        this.converged = converged;
        this.gapHint = gapHint;
    }

    public int getIndex() {
        return index;
    }

    public List<String> getVariants() {
        return variants;
    }

    public Map<ResultCategory, List<EnrichedResult>> getResults() {
        return results;
    }

    public List<EnrichedResult> getResults(ResultCategory category) {
        List<EnrichedResult> list = results.get(category);
        return list == null ? List.of() : list;
    }

    public Map<ResultCategory, List<ScrapeJobHandle>> getJobHandles() {
        return jobHandles;
    }

    public int getBlockedCount() {
        return blockedCount;
    }

    public EvaluationVerdict getVerdict() {
        return verdict;
    }

    public boolean isConverged() {
        return converged;
    }

    public String getGapHint() {
        return gapHint;
    }

    public int resultCount() {
        int count = 0;
        for (List<EnrichedResult> list : results.values()) {
            count += list.size();
        }
        return count;
    }

    public int jobCount() {
        if (jobHandles == null) {
            return 0;
        }
        int count = 0;
        for (List<ScrapeJobHandle> list : jobHandles.values()) {
            count += list.size();
        }
        return count;
    }
}
