package com.asl.search.billing;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.scrape.ScrapeContext;
import java.util.Collection;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * One credit per page, plus surcharges for structured extraction, stealth proxies and
 * extra PDF pages.
 */
@Component
public class ScrapeCreditCalculator implements CreditCalculator {
    static final int BASE_CREDITS = 1;
    static final int JSON_FORMAT_CREDITS = 4;
    static final int STEALTH_PROXY_CREDITS = 4;

    @Override
    public int creditsFor(EnrichedResult result, ScrapeContext context) {
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
        int credits = BASE_CREDITS;
        if (context != null && requestsJson(context.getScrapeOptions())) {
            credits += JSON_FORMAT_CREDITS;
        }
        Map<String, Object> metadata = result.getMetadata();
        if (metadata != null) {
            if ("stealth".equals(metadata.get("proxyUsed"))) {
                credits += STEALTH_PROXY_CREDITS;
            }
            Object numPages = metadata.get("numPages");
            if (numPages instanceof Number) {
                credits += Math.max(0, ((Number) numPages).intValue() - 1);
            }
        }
        return credits;
    }

    static boolean requestsJson(Map<String, Object> scrapeOptions) {
        if (scrapeOptions == null) {
            return false;
        }
        Object formats = scrapeOptions.get("formats");
        if (!(formats instanceof Collection)) {
            return false;
        }
        for (Object format : (Collection<?>) formats) {
            if ("json".equals(format)) {
                return true;
            }
            if (format instanceof Map && "json".equals(((Map<?, ?>) format).get("type"))) {
                return true;
            }
        }
        return false;
    }
}
