package com.asl.search.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextSimilarityTest {

    @Test
    void identicalTokenSetsIgnoreCaseAndPunctuation() {
        assertThat(TextSimilarity.jaccard("Electric Cars!", "electric, cars")).isEqualTo(1.0);
    }

    @Test
    void partialOverlapIsIntersectionOverUnion() {
        double sim = TextSimilarity.jaccard("electric cars 2024", "best electric cars");

        assertThat(sim).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shortTokensAreIgnored() {
        assertThat(TextSimilarity.jaccard("a an to", "a an to")).isEqualTo(0.0);
        assertThat(TextSimilarity.tokens("an EV is ok")).isEmpty();
    }

    @Test
    void cumulativeSumsAcrossQueries() {
        double sum = TextSimilarity.cumulative("electric cars", List.of("electric cars", "electric trucks"));

        assertThat(sum).isCloseTo(1.0 + 1.0 / 3.0, within(1e-9));
        assertThat(TextSimilarity.cumulative("  ", List.of("electric cars"))).isEqualTo(0.0);
        assertThat(TextSimilarity.cumulative(null, List.of("electric cars"))).isEqualTo(0.0);
    }
}
