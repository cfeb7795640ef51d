package com.asl.search.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns completion output into a list of strings. Stages run in order and each one is
 * tried only when the previous one failed: strict JSON array, JSON array inside a code
 * fence, then a line/comma split with bullets and numbering removed.
 */
public class VariantListParser {
    private static final Pattern LEADING_FENCE = Pattern.compile("^```[a-zA-Z]*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("```$");
    private static final Pattern SEPARATORS = Pattern.compile("\\n|,");
    private static final Pattern LEADING_MARKERS = Pattern.compile("^[-*\\d.\\s]+");

    private final ObjectMapper objectMapper;

    public VariantListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ParseResult> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<List<String>> parsed = parseJsonArray(text);
        if (parsed.isPresent()) {
            return Optional.of(new ParseResult(parsed.get(), Stage.JSON));
        }
        parsed = parseFenced(text);
        if (parsed.isPresent()) {
            return Optional.of(new ParseResult(parsed.get(), Stage.FENCED_JSON));
        }
        parsed = parseLines(text);
        return parsed.map(values -> new ParseResult(values, Stage.LINES));
    }

    public Optional<List<String>> parseJsonArray(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(text);
            if (root == null || !root.isArray()) {
                return Optional.empty();
            }
            List<String> values = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                if (node.isNull() || node.isContainerNode()) {
                    continue;
                }
                values.add(node.asText());
            }
            return Optional.of(values);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public Optional<List<String>> parseFenced(String text) {
        return parseJsonArray(stripFence(text));
    }

    public Optional<List<String>> parseLines(String text) {
        String cleaned = stripFence(text);
        if (cleaned == null || cleaned.isEmpty()) {
            return Optional.empty();
        }
        Set<String> values = new LinkedHashSet<>();
        for (String part : SEPARATORS.split(cleaned)) {
            String value = LEADING_MARKERS.matcher(part).replaceFirst("").trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(new ArrayList<>(values));
    }

    static String stripFence(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.trim();
        cleaned = LEADING_FENCE.matcher(cleaned).replaceFirst("").trim();
        cleaned = TRAILING_FENCE.matcher(cleaned).replaceFirst("").trim();
        return cleaned;
    }

    public enum Stage {
        JSON,
        FENCED_JSON,
        LINES
    }

    public static class ParseResult {
        private final List<String> values;
        private final Stage stage;

        public ParseResult(List<String> values, Stage stage) {
            this.values = values;
            this.stage = stage;
        }

        public List<String> getValues() {
            return values;
        }

        public Stage getStage() {
            return stage;
        }
    }
}
