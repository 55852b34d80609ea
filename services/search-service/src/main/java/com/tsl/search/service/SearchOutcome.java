package com.tsl.search.service;

import com.tsl.search.model.StructuredFilter;
import java.util.List;
import java.util.Map;

public final class SearchOutcome {
    private final SearchMode mode;
    private final List<SearchHit> hits;
    private final StructuredFilter filter;
    private final boolean rewriteDegraded;
    private final int lexicalCount;
    private final int vectorCount;
    private final boolean partial;
    private final Map<String, StageStatus> stages;
    private final List<String> warnings;
    private final long tookMs;

    public SearchOutcome(
        SearchMode mode,
        List<SearchHit> hits,
        StructuredFilter filter,
        boolean rewriteDegraded,
        int lexicalCount,
        int vectorCount,
        boolean partial,
        Map<String, StageStatus> stages,
        List<String> warnings,
        long tookMs
    ) {
        this.mode = mode;
        this.hits = hits == null ? List.of() : List.copyOf(hits);
        this.filter = filter;
        this.rewriteDegraded = rewriteDegraded;
        this.lexicalCount = lexicalCount;
        this.vectorCount = vectorCount;
        this.partial = partial;
        this.stages = stages == null ? Map.of() : Map.copyOf(stages);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.tookMs = tookMs;
    }

    public SearchMode getMode() {
        return mode;
    }

    public List<SearchHit> getHits() {
        return hits;
    }

    public StructuredFilter getFilter() {
        return filter;
    }

    public boolean isRewriteDegraded() {
        return rewriteDegraded;
    }

    public int getLexicalCount() {
        return lexicalCount;
    }

    public int getVectorCount() {
        return vectorCount;
    }

    public boolean isPartial() {
        return partial;
    }

    public Map<String, StageStatus> getStages() {
        return stages;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public long getTookMs() {
        return tookMs;
    }
}
