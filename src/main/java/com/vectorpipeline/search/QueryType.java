package com.vectorpipeline.search;

import java.util.Locale;

public enum QueryType {
    TEXT,
    VECTOR;

    public static QueryType fromName(String name) {
        if (name == null || name.isBlank()) {
            return VECTOR;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("queryType must be 'text' or 'vector', got '" + name + "'", e);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
