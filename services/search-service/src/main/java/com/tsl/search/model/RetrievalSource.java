package com.tsl.search.model;

import java.util.Locale;

public enum RetrievalSource {
    LEXICAL,
    VECTOR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
