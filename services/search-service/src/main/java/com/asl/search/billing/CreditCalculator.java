package com.asl.search.billing;

import com.asl.search.api.dto.EnrichedResult;
import com.asl.search.scrape.ScrapeContext;

/**
 * Prices one successfully fetched result.
 */
public interface CreditCalculator {
    int creditsFor(EnrichedResult result, ScrapeContext context);
}
