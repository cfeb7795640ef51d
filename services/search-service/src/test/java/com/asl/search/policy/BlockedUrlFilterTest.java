package com.asl.search.policy;

import static org.assertj.core.api.Assertions.assertThat;

import com.asl.search.api.dto.WebResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockedUrlFilterTest {

    private final BlockedUrlFilter filter = new BlockedUrlFilter(
        (url, flags) -> url.contains("blocked.example")
    );

    @Test
    void dropsBlockedUrlsAndRenumbers() {
        List<WebResult> items = List.of(
            new WebResult("https://a.example", "a", "a", 1),
            new WebResult("https://blocked.example/x", "b", "b", 2),
            new WebResult("https://c.example", "c", "c", 3)
        );

        BlockedUrlFilter.Filtered<WebResult> filtered = filter.filter(items, TeamFlags.none());

        assertThat(filtered.getBlockedCount()).isEqualTo(1);
        assertThat(filtered.getItems()).extracting(WebResult::getUrl)
            .containsExactly("https://a.example", "https://c.example");
        assertThat(filtered.getItems()).extracting(WebResult::getPosition).containsExactly(1, 2);
    }

    @Test
    void dropsItemsWithoutUrl() {
        List<WebResult> items = List.of(
            new WebResult(null, "no url", "x", 1),
            new WebResult("", "empty url", "x", 2)
        );

        BlockedUrlFilter.Filtered<WebResult> filtered = filter.filter(items, TeamFlags.none());

        assertThat(filtered.getItems()).isEmpty();
        assertThat(filtered.getBlockedCount()).isZero();
    }
}
