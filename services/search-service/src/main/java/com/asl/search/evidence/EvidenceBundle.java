package com.asl.search.evidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spans per source URL, in the order the sources were ranked.
 */
public class EvidenceBundle {
    private final Map<String, List<String>> spansByUrl = new LinkedHashMap<>();

    public void add(String url, List<String> spans) {
        if (url == null || spans == null || spans.isEmpty()) {
            return;
        }
        spansByUrl.put(url, List.copyOf(spans));
    }

    public boolean isEmpty() {
        return spansByUrl.isEmpty();
    }

    public int size() {
        return spansByUrl.size();
    }

    public List<String> urls() {
        return new ArrayList<>(spansByUrl.keySet());
    }

    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(spansByUrl);
    }

    String render() {
        StringBuilder context = new StringBuilder();
        int sourceIdx = 0;
        for (Map.Entry<String, List<String>> entry : spansByUrl.entrySet()) {
            if (sourceIdx > 0) {
                context.append("\n\n");
            }
            sourceIdx++;
            context.append("Source ").append(sourceIdx).append(": ").append(entry.getKey());
            List<String> spans = entry.getValue();
            for (int i = 0; i < spans.size(); i++) {
                context.append('\n').append("Span ").append(i + 1).append(": ").append(spans.get(i));
            }
        }
        return context.toString();
    }
}
