package com.asl.search.category;

import com.asl.search.api.dto.SearchResultItem;
import java.util.ArrayList;
import java.util.List;

public final class CategoryLabeler {
    public static final String UNLABELED = "unlabeled";

    private CategoryLabeler() {
    }

    public static String label(String url, List<CategoryRule> rules) {
        if (rules != null) {
            for (CategoryRule rule : rules) {
                if (rule.matches(url)) {
                    return rule.getCategory();
                }
            }
        }
        return UNLABELED;
    }

    public static <T extends SearchResultItem> List<T> labelAll(List<T> items, List<CategoryRule> rules) {
        List<T> labeled = new ArrayList<>(items.size());
        for (T item : items) {
            @SuppressWarnings("unchecked")
            T copy = (T) item.copy();
            copy.setCategory(label(item.getUrl(), rules));
            labeled.add(copy);
        }
        return labeled;
    }
}
