package com.asl.search.service;

import java.util.ArrayList;
import java.util.List;

public final class ResultLimiter {
    private ResultLimiter() {
    }

    public static <T> List<T> limit(List<T> items, int limit) {
        if (items == null || limit <= 0) {
            return new ArrayList<>();
        }
        return new ArrayList<>(items.subList(0, Math.min(limit, items.size())));
    }
}
