package com.tsl.search.service;

import java.util.Locale;

public enum SearchMode {
    LEXICAL,
    VECTOR,
    HYBRID,
    // raw query against BM25 only, no rewrite
    BASELINE;

    public boolean usesLexical() {
        return this != VECTOR;
    }

    public boolean usesVector() {
        return this == VECTOR || this == HYBRID;
    }

    public boolean usesRewrite() {
        return this != BASELINE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SearchMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        try {
            return SearchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSearchRequestException("invalid_mode:" + value.trim());
        }
    }
}
