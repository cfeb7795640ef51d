package com.asl.search.category;

import java.util.regex.Pattern;

public class CategoryRule {
    private final Pattern pattern;
    private final String category;

    public CategoryRule(Pattern pattern, String category) {
        this.pattern = pattern;
        this.category = category;
    }

    /**
     * Matches the host and every subdomain of it, regardless of scheme, port or path.
     */
    public static CategoryRule forHost(String host, String category) {
        Pattern pattern = Pattern.compile(
            "^[a-z][a-z0-9+.-]*://([^/?#@]*@)?([^/?#]*\\.)?" + Pattern.quote(host) + "(:\\d+)?([/?#]|$)",
            Pattern.CASE_INSENSITIVE
        );
        return new CategoryRule(pattern, category);
    }

    public static CategoryRule forPathSuffix(String suffix, String category) {
        Pattern pattern = Pattern.compile(Pattern.quote(suffix) + "([?#]|$)", Pattern.CASE_INSENSITIVE);
        return new CategoryRule(pattern, category);
    }

    public boolean matches(String url) {
        return url != null && pattern.matcher(url).find();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getCategory() {
        return category;
    }
}
