package com.asl.search.policy;

import com.asl.search.api.dto.SearchResultItem;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drops items the team may not fetch and renumbers the survivors 1..N.
 */
@Component
public class BlockedUrlFilter {
    private static final Logger log = LoggerFactory.getLogger(BlockedUrlFilter.class);

    private final UrlBlocklist blocklist;

    public BlockedUrlFilter(UrlBlocklist blocklist) {
        this.blocklist = blocklist;
    }

    public <T extends SearchResultItem> Filtered<T> filter(List<T> items, TeamFlags flags) {
        List<T> kept = new ArrayList<>(items.size());
        int blocked = 0;
        for (T item : items) {
            if (item.getUrl() == null || item.getUrl().isEmpty()) {
                continue;
            }
            if (blocklist.isBlocked(item.getUrl(), flags)) {
                log.info("skipping blocked url={}", item.getUrl());
                blocked++;
                continue;
            }
            @SuppressWarnings("unchecked")
            T copy = (T) item.copy();
            copy.setPosition(kept.size() + 1);
            kept.add(copy);
        }
        return new Filtered<>(kept, blocked);
    }

    public static class Filtered<T extends SearchResultItem> {
        private final List<T> items;
        private final int blockedCount;

        public Filtered(List<T> items, int blockedCount) {
            this.items = items;
            this.blockedCount = blockedCount;
        }

        public List<T> getItems() {
            return items;
        }

        public int getBlockedCount() {
            return blockedCount;
        }
    }
}
