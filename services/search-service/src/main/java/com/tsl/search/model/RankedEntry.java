package com.tsl.search.model;

public final class RankedEntry {
    private final String docId;
    private final RetrievalSource source;
    private final int rank;
    private final double rawScore;

    public RankedEntry(String docId, RetrievalSource source, int rank, double rawScore) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId required");
        }
        if (rank < 1) {
            throw new IllegalArgumentException("rank is 1-based: " + rank);
        }
        this.docId = docId;
        this.source = source;
        this.rank = rank;
        this.rawScore = rawScore;
    }

    public String getDocId() {
        return docId;
    }

    public RetrievalSource getSource() {
        return source;
    }

    public int getRank() {
        return rank;
    }

    public double getRawScore() {
        return rawScore;
    }

    @Override
    public String toString() {
        return source + "#" + rank + ":" + docId + "(" + rawScore + ")";
    }
}
