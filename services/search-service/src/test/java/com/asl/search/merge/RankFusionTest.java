package com.asl.search.merge;

import static org.assertj.core.api.Assertions.assertThat;

import com.asl.search.api.dto.WebResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RankFusionTest {

    @Test
    void urlInTwoListsOutranksUrlInOneList() {
        for (int k : new int[] {1, 10, 60, 1000}) {
            List<List<WebResult>> lists = List.of(
                List.of(web("https://shared.example", 1), web("https://a.example", 2)),
                List.of(web("https://shared.example", 1), web("https://b.example", 2)),
                List.of(web("https://solo.example", 1))
            );

            List<RankFusion.Candidate<WebResult>> fused = RankFusion.fuse(lists, List.of("qqq"), k, 0.1);

            assertThat(fused.get(0).getItem().getUrl()).isEqualTo("https://shared.example");
            assertThat(fused.get(0).getScore()).isGreaterThan(scoreOf(fused, "https://solo.example"));
        }
    }

    @Test
    void baseScoreIsSumOfReciprocalRanks() {
        List<List<WebResult>> lists = List.of(
            List.of(web("https://x.example", 1)),
            List.of(web("https://y.example", 1), web("https://x.example", 3))
        );

        List<RankFusion.Candidate<WebResult>> fused = RankFusion.fuse(lists, List.of(), 60, 0.1);

        RankFusion.Candidate<WebResult> x = fused.stream()
            .filter(c -> c.getItem().getUrl().equals("https://x.example"))
            .findFirst()
            .orElseThrow();
        assertThat(x.getBase()).isEqualTo(1.0 / 61 + 1.0 / 63);
        assertThat(x.getSimilarity()).isEqualTo(0.0);
    }

    @Test
    void representativeIsSmallestRankThenEarliestVariant() {
        List<List<WebResult>> lists = List.of(
            List.of(web("https://a.example", "first title", 2), web("https://b.example", "far", 3)),
            List.of(web("https://a.example", "second title", 2), web("https://b.example", "near", 1))
        );

        List<WebResult> fused = RankFusion.fuseItems(lists, List.of());

        assertThat(titleOf(fused, "https://a.example")).isEqualTo("first title");
        assertThat(titleOf(fused, "https://b.example")).isEqualTo("near");
    }

    @Test
    void similarityBoostUsesRepresentativeText() {
        WebResult relevant = new WebResult("https://relevant.example", "unrelated", "electric cars ranked", 2);
        WebResult plain = new WebResult("https://plain.example", "unrelated", "nothing matching", 1);

        List<RankFusion.Candidate<WebResult>> fused = RankFusion.fuse(
            List.of(List.of(plain, relevant)),
            List.of("electric cars ranked"),
            60,
            0.1
        );

        assertThat(fused.get(0).getItem().getUrl()).isEqualTo("https://relevant.example");
        assertThat(fused.get(0).getSimilarity()).isEqualTo(1.0);
    }

    @Test
    void equalScoresBreakTiesByUrl() {
        List<List<WebResult>> lists = List.of(
            List.of(web("https://zeta.example", 1)),
            List.of(web("https://alpha.example", 1))
        );

        List<WebResult> fused = RankFusion.fuseItems(lists, List.of());

        assertThat(fused).extracting(WebResult::getUrl)
            .containsExactly("https://alpha.example", "https://zeta.example");
    }

    @Test
    void outputHasEveryDistinctUrlOnceWithDensePositions() {
        List<List<WebResult>> lists = List.of(
            List.of(web("https://a.example", 1), web("https://b.example", 2), web("https://c.example", 3)),
            List.of(web("https://c.example", 1), web("https://d.example", 2)),
            List.of()
        );

        List<WebResult> fused = RankFusion.fuseItems(lists, List.of("query"));

        Set<String> urls = new HashSet<>();
        for (WebResult item : fused) {
            urls.add(item.getUrl());
        }
        assertThat(fused).hasSize(4);
        assertThat(urls).containsExactlyInAnyOrder(
            "https://a.example", "https://b.example", "https://c.example", "https://d.example");
        assertThat(fused).extracting(WebResult::getPosition).containsExactly(1, 2, 3, 4);
    }

    @Test
    void fusionIsDeterministic() {
        List<List<WebResult>> lists = List.of(
            List.of(web("https://a.example", 1), web("https://b.example", 2)),
            List.of(web("https://b.example", 1), web("https://a.example", 2)),
            List.of(web("https://c.example", 1))
        );

        List<String> first = urls(RankFusion.fuseItems(lists, List.of("alpha query")));
        List<String> second = urls(RankFusion.fuseItems(lists, List.of("alpha query")));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void doesNotMutateInputItems() {
        WebResult original = web("https://a.example", 7);

        RankFusion.fuseItems(List.of(List.of(original)), List.of());

        assertThat(original.getPosition()).isEqualTo(7);
    }

    @Test
    void missingPositionFallsBackToListIndex() {
        WebResult unranked = new WebResult("https://late.example", "t", "d", null);
        WebResult ranked = web("https://early.example", 1);

        List<RankFusion.Candidate<WebResult>> fused = RankFusion.fuse(
            List.of(List.of(ranked, unranked)), List.of(), 60, 0.1);

        assertThat(scoreOf(fused, "https://late.example")).isEqualTo(1.0 / 62);
    }

    @Test
    void overlappingUrlsFromTwoVariantsRankAboveSingleVariantUrls() {
        List<String> variants = List.of("best electric cars 2024", "top rated EVs this year");
        List<WebResult> first = new ArrayList<>();
        List<WebResult> second = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            first.add(web("https://first" + i + ".example", i));
            second.add(web("https://second" + i + ".example", i));
        }
        first.add(web("https://overlap-a.example", 4));
        first.add(web("https://overlap-b.example", 5));
        second.add(web("https://overlap-b.example", 4));
        second.add(web("https://overlap-a.example", 5));

        List<WebResult> fused = RankFusion.fuseItems(List.of(first, second), variants);

        assertThat(fused).hasSizeLessThanOrEqualTo(8);
        assertThat(fused).hasSize(8);
        assertThat(urls(fused).subList(0, 2))
            .containsExactlyInAnyOrder("https://overlap-a.example", "https://overlap-b.example");
    }

    private static WebResult web(String url, int position) {
        return web(url, "zz", position);
    }

    private static WebResult web(String url, String title, int position) {
        return new WebResult(url, title, "", position);
    }

    private static double scoreOf(List<RankFusion.Candidate<WebResult>> fused, String url) {
        return fused.stream()
            .filter(c -> c.getItem().getUrl().equals(url))
            .findFirst()
            .orElseThrow()
            .getScore();
    }

    private static String titleOf(List<WebResult> fused, String url) {
        return fused.stream().filter(w -> w.getUrl().equals(url)).findFirst().orElseThrow().getTitle();
    }

    private static List<String> urls(List<WebResult> items) {
        List<String> urls = new ArrayList<>();
        for (WebResult item : items) {
            urls.add(item.getUrl());
        }
        return urls;
    }
}
