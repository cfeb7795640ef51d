package com.asl.search.merge;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextSimilarity {
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TOKEN_LENGTH = 3;

    private TextSimilarity() {
    }

    /**
     * Jaccard similarity of the two token sets; 0 when either side has no token of length >= 3.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }

    public static double cumulative(String text, List<String> queries) {
        if (text == null || text.isBlank() || queries == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (String query : queries) {
            sum += jaccard(text, query);
        }
        return sum;
    }

    static Set<String> tokens(String value) {
        Set<String> tokens = new HashSet<>();
        if (value == null) {
            return tokens;
        }
        String cleaned = NON_ALNUM.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ");
        for (String token : WHITESPACE.split(cleaned)) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
