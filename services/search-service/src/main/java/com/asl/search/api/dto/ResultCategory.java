package com.asl.search.api.dto;

import java.util.Locale;

public enum ResultCategory {
    WEB("web"),
    IMAGES("images"),
    NEWS("news");

    private final String key;

    ResultCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ResultCategory fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return null;
        }
        if (normalized.equals("web")) {
            return WEB;
        }
        if (normalized.startsWith("image")) {
            return IMAGES;
        }
        if (normalized.equals("news")) {
            return NEWS;
        }
        return null;
    }
}
