package com.asl.search.query;

import com.asl.search.completion.CompletionOptions;
import com.asl.search.completion.TextCompletion;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class QueryExpander {
    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final double TEMPERATURE = 0.2;

    private final VariantListParser parser;

    public QueryExpander(ObjectMapper objectMapper) {
        this.parser = new VariantListParser(objectMapper);
    }

    /**
     * Returns at most {@code maxVariants} queries, the normalized original first, the rest
     * unique ignoring case. Falls back to the original alone on any failure.
     */
    public List<String> expand(String query, String gapHint, int maxVariants, TextCompletion completion) {
        String original = normalize(query);
        if (maxVariants <= 1 || completion == null) {
            return List.of(original);
        }
        try {
            String text = completion.complete(buildPrompt(original, gapHint, maxVariants - 1),
                CompletionOptions.withTemperature(TEMPERATURE));
            Optional<VariantListParser.ParseResult> parsed = parser.parse(text);
            if (parsed.isEmpty()) {
                log.debug("query expansion unparseable; using original only");
                return List.of(original);
            }
            if (parsed.get().getStage() != VariantListParser.Stage.JSON) {
                log.debug("query expansion parsed via fallback stage={}", parsed.get().getStage());
            }
            return assemble(original, parsed.get().getValues(), maxVariants);
        } catch (RuntimeException e) {
            log.warn("query expansion failed: {}", e.getMessage());
            return List.of(original);
        }
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    static List<String> assemble(String original, List<String> candidates, int maxVariants) {
        List<String> variants = new ArrayList<>();
        variants.add(original);
        Set<String> seen = new HashSet<>();
        seen.add(original.toLowerCase(Locale.ROOT));
        for (String candidate : candidates) {
            if (variants.size() >= maxVariants) {
                break;
            }
            String variant = normalize(candidate);
            if (variant.isEmpty() || !seen.add(variant.toLowerCase(Locale.ROOT))) {
                continue;
            }
            variants.add(variant);
        }
        return variants;
    }

    private String buildPrompt(String original, String gapHint, int alternatives) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You improve a web search query and generate up to ")
            .append(alternatives)
            .append(" concise alternative queries (<= 12 words each). ")
            .append("Focus on retrieving sources that directly answer the question. ")
            .append("If hints of missing facts are provided, incorporate them.\n\n")
            .append("Base query: ").append(original).append('\n');
        if (gapHint != null && !gapHint.isBlank()) {
            prompt.append("Missing facts to target: ").append(gapHint).append('\n');
        }
        prompt.append("\nReturn ONLY a JSON array of strings.");
        return prompt.toString();
    }
}
