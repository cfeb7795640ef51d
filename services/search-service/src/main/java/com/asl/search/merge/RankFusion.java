package com.asl.search.merge;

import com.asl.search.api.dto.SearchResultItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion across query variants with a snippet-similarity boost.
 * Output holds every distinct URL exactly once, ordered by score then URL.
 */
public final class RankFusion {
    public static final int DEFAULT_K = 60;
    public static final double DEFAULT_BETA = 0.1;

    private RankFusion() {
    }

    public static <T extends SearchResultItem> List<T> fuseItems(List<List<T>> lists, List<String> queries) {
        return toItems(fuse(lists, queries, DEFAULT_K, DEFAULT_BETA));
    }

    public static <T extends SearchResultItem> List<Candidate<T>> fuse(
        List<List<T>> lists,
        List<String> queries,
        int k,
        double beta
    ) {
        Map<String, MutableCandidate<T>> candidates = new LinkedHashMap<>();
        if (lists != null) {
            for (int variantIdx = 0; variantIdx < lists.size(); variantIdx++) {
                List<T> list = lists.get(variantIdx);
                if (list == null) {
                    continue;
                }
                for (int idx = 0; idx < list.size(); idx++) {
                    T item = list.get(idx);
                    if (item == null || item.getUrl() == null || item.getUrl().isEmpty()) {
                        continue;
                    }
                    int rank = item.getPosition() != null ? item.getPosition() : idx + 1;
                    MutableCandidate<T> candidate = candidates.computeIfAbsent(item.getUrl(), MutableCandidate::new);
                    candidate.base += 1.0 / (k + rank);
                    candidate.offer(item, rank, variantIdx);
                }
            }
        }

        List<MutableCandidate<T>> mutable = new ArrayList<>(candidates.values());
        for (MutableCandidate<T> candidate : mutable) {
            candidate.sim = TextSimilarity.cumulative(candidate.bestItem.similarityText(), queries);
            candidate.score = candidate.base + beta * candidate.sim;
        }
        mutable.sort(
            Comparator.comparingDouble((MutableCandidate<T> c) -> c.score).reversed()
                .thenComparing(c -> c.url)
        );

        List<Candidate<T>> fused = new ArrayList<>(mutable.size());
        for (int i = 0; i < mutable.size(); i++) {
            MutableCandidate<T> candidate = mutable.get(i);
            @SuppressWarnings("unchecked")
            T item = (T) candidate.bestItem.copy();
            item.setPosition(i + 1);
            fused.add(new Candidate<>(item, candidate.score, candidate.base, candidate.sim, candidate.bestVariantIdx));
        }
        return fused;
    }

    public static <T extends SearchResultItem> List<T> toItems(List<Candidate<T>> candidates) {
        List<T> items = new ArrayList<>(candidates.size());
        for (Candidate<T> candidate : candidates) {
            items.add(candidate.getItem());
        }
        return items;
    }

    public static final class Candidate<T extends SearchResultItem> {
        private final T item;
        private final double score;
        private final double base;
        private final double similarity;
        private final int sourceVariant;

        public Candidate(T item, double score, double base, double similarity, int sourceVariant) {
            this.item = item;
            this.score = score;
            this.base = base;
            this.similarity = similarity;
            this.sourceVariant = sourceVariant;
        }

        public T getItem() {
            return item;
        }

        public double getScore() {
            return score;
        }

        public double getBase() {
            return base;
        }

        public double getSimilarity() {
            return similarity;
        }

        public int getSourceVariant() {
            return sourceVariant;
        }
    }

    private static final class MutableCandidate<T extends SearchResultItem> {
        private final String url;
        private double base;
        private double sim;
        private double score;
        private T bestItem;
        private int bestRank = Integer.MAX_VALUE;
        private int bestVariantIdx = Integer.MAX_VALUE;

        private MutableCandidate(String url) {
            this.url = url;
        }

        // smallest rank wins; on equal rank the earliest variant keeps it
        private void offer(T item, int rank, int variantIdx) {
            if (bestItem == null || rank < bestRank || (rank == bestRank && variantIdx < bestVariantIdx)) {
                bestItem = item;
                bestRank = rank;
                bestVariantIdx = variantIdx;
            }
        }
    }
}
