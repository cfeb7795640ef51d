package com.asl.search.merge;

import static org.assertj.core.api.Assertions.assertThat;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.api.dto.WebResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class FinalRerankerTest {

    @Test
    void ordersBySnippetSimilarityAndRenumbers() {
        List<EnrichedResult> results = List.of(
            EnrichedResult.unfetched(new WebResult("https://a.example", "Other", "cooking recipes", 1)),
            EnrichedResult.unfetched(new WebResult("https://b.example", "Other", "electric cars review", 2))
        );

        List<EnrichedResult> reranked = FinalReranker.rerank(results, List.of("electric cars review"));

        assertThat(reranked).extracting(r -> r.getItem().getUrl())
            .containsExactly("https://b.example", "https://a.example");
        assertThat(reranked).extracting(r -> r.getItem().getPosition()).containsExactly(1, 2);
    }

    @Test
    void fallsBackToTitleWhenSnippetIsEmpty() {
        List<EnrichedResult> results = List.of(
            EnrichedResult.unfetched(new WebResult("https://a.example", "unrelated words", "", 1)),
            EnrichedResult.unfetched(new WebResult("https://b.example", "electric cars", "", 2))
        );

        List<EnrichedResult> reranked = FinalReranker.rerank(results, List.of("electric cars"));

        assertThat(reranked.get(0).getItem().getUrl()).isEqualTo("https://b.example");
    }

    @Test
    void tiesKeepIncomingOrder() {
        List<EnrichedResult> results = List.of(
            EnrichedResult.unfetched(new WebResult("https://c.example", "same", "same text", 1)),
            EnrichedResult.unfetched(new WebResult("https://a.example", "same", "same text", 2)),
            EnrichedResult.unfetched(new WebResult("https://b.example", "same", "same text", 3))
        );

        List<EnrichedResult> reranked = FinalReranker.rerank(results, List.of("unrelated query"));

        assertThat(reranked).extracting(r -> r.getItem().getUrl())
            .containsExactly("https://c.example", "https://a.example", "https://b.example");
    }
}
