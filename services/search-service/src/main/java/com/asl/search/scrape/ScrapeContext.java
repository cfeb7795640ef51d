package com.asl.search.scrape;

import com.asl.search.policy.TeamFlags;
import java.util.Map;

public class ScrapeContext {
    private final String teamId;
    private final String origin;
    private final long timeoutMs;
    private final Map<String, Object> scrapeOptions;
    private final Long apiKeyId;
    private final TeamFlags flags;

    public ScrapeContext(
        String teamId,
        String origin,
        long timeoutMs,
        Map<String, Object> scrapeOptions,
        Long apiKeyId,
        TeamFlags flags
    ) {
        this.teamId = teamId;
        this.origin = origin;
        this.timeoutMs = timeoutMs;
        this.scrapeOptions = scrapeOptions == null ? Map.of() : scrapeOptions;
        this.apiKeyId = apiKeyId;
        this.flags = flags == null ? TeamFlags.none() : flags;
    }

    public String getTeamId() {
        return teamId;
    }

    public String getOrigin() {
        return origin;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public Map<String, Object> getScrapeOptions() {
        return scrapeOptions;
    }

    public Long getApiKeyId() {
        return apiKeyId;
    }

    public TeamFlags getFlags() {
        return flags;
    }
}
