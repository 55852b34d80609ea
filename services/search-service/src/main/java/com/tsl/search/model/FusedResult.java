package com.tsl.search.model;

import java.util.List;

public final class FusedResult {
    private final String docId;
    private final double fusedScore;
    private final List<RetrievalSource> sources;

    public FusedResult(String docId, double fusedScore, List<RetrievalSource> sources) {
        this.docId = docId;
        this.fusedScore = fusedScore;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public String getDocId() {
        return docId;
    }

    public double getFusedScore() {
        return fusedScore;
    }

    public List<RetrievalSource> getSources() {
        return sources;
    }

    @Override
    public String toString() {
        return docId + "=" + fusedScore + sources;
    }
}
