package com.tsl.search.ingest;

import java.util.Locale;

public enum DocumentState {
    PENDING,
    EXTRACTED,
    INDEXED,
    FAILED,
    SKIPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
