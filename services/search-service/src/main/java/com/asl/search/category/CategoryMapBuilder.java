package com.asl.search.category;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the ordered rule list for the categories a request asked for. Unknown category
 * names are rejected during request validation, so they are ignored here.
 */
public final class CategoryMapBuilder {
    public static final String GITHUB = "github";
    public static final String RESEARCH = "research";
    public static final String PDF = "pdf";
    public static final Set<String> SUPPORTED = Set.of(GITHUB, RESEARCH, PDF);

    private static final List<String> RESEARCH_HOSTS = List.of(
        "arxiv.org",
        "scholar.google.com",
        "pubmed.ncbi.nlm.nih.gov",
        "ncbi.nlm.nih.gov",
        "researchgate.net",
        "semanticscholar.org",
        "nature.com",
        "ieee.org",
        "biorxiv.org",
        "medrxiv.org"
    );

    private CategoryMapBuilder() {
    }

    public static List<CategoryRule> build(List<String> categories) {
        List<CategoryRule> rules = new ArrayList<>();
        if (categories == null) {
            return rules;
        }
        Set<String> requested = new LinkedHashSet<>();
        for (String category : categories) {
            if (category != null) {
                requested.add(category.trim().toLowerCase(Locale.ROOT));
            }
        }
        for (String category : requested) {
            switch (category) {
                case GITHUB:
                    rules.add(CategoryRule.forHost("github.com", GITHUB));
                    break;
                case RESEARCH:
                    for (String host : RESEARCH_HOSTS) {
                        rules.add(CategoryRule.forHost(host, RESEARCH));
                    }
                    break;
                case PDF:
                    rules.add(CategoryRule.forPathSuffix(".pdf", PDF));
                    break;
                default:
                    break;
            }
        }
        return rules;
    }
}
