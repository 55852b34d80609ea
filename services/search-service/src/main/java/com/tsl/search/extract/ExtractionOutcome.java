package com.tsl.search.extract;

import java.util.Locale;

public enum ExtractionOutcome {
    EXTRACTED,
    FALLBACK_PROVIDER,
    FALLBACK_SCHEMA,
    FALLBACK_CIRCUIT_OPEN;

    public boolean isFallback() {
        return this != EXTRACTED;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
