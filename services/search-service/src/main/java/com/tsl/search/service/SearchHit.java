package com.tsl.search.service;

import com.tsl.search.model.RetrievalSource;
import com.tsl.search.model.StructuredFields;
import java.util.List;

public final class SearchHit {
    private final String docId;
    private final int rank;
    private final double score;
    private final List<RetrievalSource> sources;
    private final String title;
    private final StructuredFields fields;

    public SearchHit(
        String docId,
        int rank,
        double score,
        List<RetrievalSource> sources,
        String title,
        StructuredFields fields
    ) {
        this.docId = docId;
        this.rank = rank;
        this.score = score;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.title = title;
        this.fields = fields;
    }

    public String getDocId() {
        return docId;
    }

    public int getRank() {
        return rank;
    }

    public double getScore() {
        return score;
    }

    public List<RetrievalSource> getSources() {
        return sources;
    }

    public String getTitle() {
        return title;
    }

    public StructuredFields getFields() {
        return fields;
    }
}
