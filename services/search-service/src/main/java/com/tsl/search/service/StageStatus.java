package com.tsl.search.service;

import com.tsl.search.retrieval.RetrievalStageResult;

public final class StageStatus {
    private final String status;
    private final long tookMs;
    private final int count;
    private final String error;

    public StageStatus(String status, long tookMs, int count, String error) {
        this.status = status;
        this.tookMs = tookMs;
        this.count = count;
        this.error = error;
    }

    static StageStatus of(RetrievalStageResult result) {
        return new StageStatus(
            result.getStatus().label(),
            result.getTookMs(),
            result.getEntries().size(),
            result.getErrorMessage()
        );
    }

    public String getStatus() {
        return status;
    }

    public long getTookMs() {
        return tookMs;
    }

    public int getCount() {
        return count;
    }

    public String getError() {
        return error;
    }
}
