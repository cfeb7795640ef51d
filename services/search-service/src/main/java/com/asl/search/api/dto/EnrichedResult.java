package com.asl.search.api.dto;

import com.asl.search.scrape.dto.ScrapedDocument;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fused search item, optionally overlaid with the content fetched for its URL.
 * Failed fetches keep the search fields and carry the error in {@code metadata}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrichedResult {
    static final int FAILED_STATUS_CODE = 500;

    @JsonUnwrapped
    private SearchResultItem item;

    private String markdown;
    private String html;
    private String rawHtml;
    private String screenshot;
    private List<String> links;
    private Map<String, Object> metadata;

    @JsonIgnore
    private Map<String, Object> costTracking;

    @JsonIgnore
    private boolean fetched;

    @JsonIgnore
    private boolean failed;

    private EnrichedResult(SearchResultItem item) {
        this.item = item;
    }

    public static EnrichedResult unfetched(SearchResultItem item) {
        return new EnrichedResult(item);
    }

    public static EnrichedResult fetched(SearchResultItem item, ScrapedDocument document) {
        SearchResultItem merged = item.copy();
        merged.applyFetched(document.getTitle(), document.getDescription());
        EnrichedResult result = new EnrichedResult(merged);
        result.markdown = document.getMarkdown();
        result.html = document.getHtml();
        result.rawHtml = document.getRawHtml();
        result.screenshot = document.getScreenshot();
        result.links = document.getLinks();
        result.metadata = document.getMetadata();
        result.costTracking = document.getCostTracking() == null ? Map.of() : document.getCostTracking();
        result.fetched = true;
        return result;
    }

    public static EnrichedResult failed(SearchResultItem item, String error) {
        EnrichedResult result = new EnrichedResult(item.copy());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("statusCode", FAILED_STATUS_CODE);
        metadata.put("error", error);
        metadata.put("proxyUsed", "basic");
        result.metadata = metadata;
        result.costTracking = Map.of();
        result.fetched = true;
        result.failed = true;
        return result;
    }

    public EnrichedResult withPosition(int position) {
        EnrichedResult copy = new EnrichedResult(item.copy());
        copy.item.setPosition(position);
        copy.markdown = markdown;
        copy.html = html;
        copy.rawHtml = rawHtml;
        copy.screenshot = screenshot;
        copy.links = links;
        copy.metadata = metadata;
        copy.costTracking = costTracking;
        copy.fetched = fetched;
        copy.failed = failed;
        return copy;
    }

    public SearchResultItem getItem() {
        return item;
    }

    public String getMarkdown() {
        return markdown;
    }

    public String getHtml() {
        return html;
    }

    public String getRawHtml() {
        return rawHtml;
    }

    public String getScreenshot() {
        return screenshot;
    }

    public List<String> getLinks() {
        return links;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getCostTracking() {
        return costTracking;
    }

    public boolean isFetched() {
        return fetched;
    }

    public boolean isFailed() {
        return failed;
    }
}
