package com.asl.search.scrape;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.scrape")
public class ScrapeProperties {
    private String forceEngine = "fire-engine;tlsclient";
    private long maxAgeMs = 3L * 24 * 60 * 60 * 1000;
    private int basePriority = 10;
    private long joinGraceMs = 5000;

    public String getForceEngine() {
        return forceEngine;
    }

    public void setForceEngine(String forceEngine) {
        this.forceEngine = forceEngine;
    }

    public long getMaxAgeMs() {
        return maxAgeMs;
    }

    public void setMaxAgeMs(long maxAgeMs) {
        this.maxAgeMs = maxAgeMs;
    }

    public int getBasePriority() {
        return basePriority;
    }

    public void setBasePriority(int basePriority) {
        this.basePriority = basePriority;
    }

    public long getJoinGraceMs() {
        return joinGraceMs;
    }

    public void setJoinGraceMs(long joinGraceMs) {
        this.joinGraceMs = joinGraceMs;
    }
}
