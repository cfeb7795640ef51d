package com.asl.search.merge;

import com.asl.search.api.dto.EnrichedResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Re-orders web results by cumulative snippet-to-query similarity. The sort is stable,
 * so equal scores keep the order produced by the iteration loop.
 */
public final class FinalReranker {
    private FinalReranker() {
    }

    public static List<EnrichedResult> rerank(List<EnrichedResult> results, List<String> queries) {
        if (results == null || results.isEmpty()) {
            return results;
        }
        List<Scored> scored = new ArrayList<>(results.size());
        for (EnrichedResult result : results) {
            double score = TextSimilarity.cumulative(result.getItem().similarityText(), queries);
            scored.add(new Scored(result, score));
        }
        scored.sort(Comparator.comparingDouble((Scored s) -> s.score).reversed());

        List<EnrichedResult> reranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            reranked.add(scored.get(i).result.withPosition(i + 1));
        }
        return reranked;
    }

    private static final class Scored {
        private final EnrichedResult result;
        private final double score;

        private Scored(EnrichedResult result, double score) {
            this.result = result;
            this.score = score;
        }
    }
}
