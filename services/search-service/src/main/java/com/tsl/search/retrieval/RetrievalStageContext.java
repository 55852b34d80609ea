package com.tsl.search.retrieval;

import com.tsl.search.model.StructuredFilter;
import java.util.List;
import java.util.concurrent.Future;

public class RetrievalStageContext {
    private final String queryText;
    private final StructuredFilter filter;
    private final int topK;
    private final Integer timeBudgetMs;
    private final Future<List<Double>> queryEmbedding;

    public RetrievalStageContext(
        String queryText,
        StructuredFilter filter,
        int topK,
        Integer timeBudgetMs,
        Future<List<Double>> queryEmbedding
    ) {
        this.queryText = queryText;
        this.filter = filter == null ? StructuredFilter.unconstrained() : filter;
        this.topK = topK;
        this.timeBudgetMs = timeBudgetMs;
        this.queryEmbedding = queryEmbedding;
    }

    public String getQueryText() {
        return queryText;
    }

    public StructuredFilter getFilter() {
        return filter;
    }

    public int getTopK() {
        return topK;
    }

    public Integer getTimeBudgetMs() {
        return timeBudgetMs;
    }

    public Future<List<Double>> getQueryEmbedding() {
        return queryEmbedding;
    }
}
