package com.asl.search.evidence;

import com.asl.search.api.dto.EnrichedResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Picks the paragraphs of a fetched page that mention the most query terms.
 */
@Component
public class SpanExtractor {
    public static final int DEFAULT_MAX_SPANS = 3;
    static final int MAX_SPAN_CHARS = 550;
    static final String TRUNCATION_MARKER = "...";

    private static final Pattern LINKED_IMAGE = Pattern.compile("\\[!\\[[\\s\\S]*?\\]\\([\\s\\S]*?\\)\\]\\([\\s\\S]*?\\)");
    private static final Pattern IMAGE = Pattern.compile("!\\[[\\s\\S]*?\\]\\([\\s\\S]*?\\)");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[\\t ]+");
    private static final Pattern LINE_EDGES = Pattern.compile(" *\\n *");
    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*[-*•]|^\\s*\\d+\\.");
    private static final Pattern QUERY_SPLIT = Pattern.compile("[^a-z0-9]+");
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final double LENGTH_NORM = 400.0;
    private static final double LENGTH_WEIGHT = 0.25;

    public List<String> extract(String markdown, String query) {
        return extract(markdown, query, DEFAULT_MAX_SPANS);
    }

    public List<String> extract(String markdown, String query, int maxSpans) {
        if (markdown == null || markdown.trim().isEmpty()) {
            return List.of();
        }
        String cleaned = LINKED_IMAGE.matcher(markdown).replaceAll("");
        cleaned = IMAGE.matcher(cleaned).replaceAll("");
        cleaned = HORIZONTAL_SPACE.matcher(cleaned).replaceAll(" ");
        cleaned = LINE_EDGES.matcher(cleaned).replaceAll("\n");

        List<Block> blocks = new ArrayList<>();
        for (String raw : BLANK_LINE.split(cleaned)) {
            String block = WHITESPACE.matcher(raw).replaceAll(" ").trim();
            if (block.isEmpty() || LIST_ITEM.matcher(block).find()) {
                continue;
            }
            blocks.add(new Block(block));
        }

        Set<String> tokens = queryTokens(query);
        for (Block block : blocks) {
            block.score = score(block.text, tokens);
        }
        // List.sort is stable, so equal scores keep document order
        blocks.sort(Comparator.comparingDouble((Block b) -> b.score).reversed());

        int limit = Math.min(blocks.size(), Math.max(1, maxSpans));
        List<String> spans = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            spans.add(truncate(blocks.get(i).text));
        }
        return spans;
    }

    /**
     * Collects spans from every successfully fetched result that has page text.
     */
    public EvidenceBundle collect(List<EnrichedResult> results, String query, int maxSpans) {
        EvidenceBundle bundle = new EvidenceBundle();
        if (results == null) {
            return bundle;
        }
        for (EnrichedResult result : results) {
            if (!result.isFetched() || result.isFailed()) {
                continue;
            }
            List<String> spans = extract(result.getMarkdown(), query, maxSpans);
            bundle.add(result.getItem().getUrl(), spans);
        }
        return bundle;
    }

    static Set<String> queryTokens(String query) {
        Set<String> tokens = new LinkedHashSet<>();
        if (query == null) {
            return tokens;
        }
        for (String token : QUERY_SPLIT.split(query.toLowerCase(Locale.ROOT))) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static double score(String block, Set<String> tokens) {
        String lower = block.toLowerCase(Locale.ROOT);
        double score = 0.0;
        for (String token : tokens) {
            if (lower.contains(token)) {
                score += 1.0;
            }
        }
        return score + Math.min(block.length() / LENGTH_NORM, 1.0) * LENGTH_WEIGHT;
    }

    static String truncate(String block) {
        if (block.length() <= MAX_SPAN_CHARS) {
            return block;
        }
        return block.substring(0, MAX_SPAN_CHARS - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }

    private static final class Block {
        private final String text;
        private double score;

        private Block(String text) {
            this.text = text;
        }
    }
}
