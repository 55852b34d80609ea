package com.tsl.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
