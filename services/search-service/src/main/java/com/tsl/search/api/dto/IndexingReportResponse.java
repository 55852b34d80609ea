package com.tsl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tsl.search.ingest.DocumentState;
import com.tsl.search.ingest.IndexingReport;
import java.util.List;

public class IndexingReportResponse {
    private int total;
    private int indexed;
    private int failed;
    private int skipped;

    @JsonProperty("failed_ids")
    private List<String> failedIds;

    @JsonProperty("skipped_ids")
    private List<String> skippedIds;

    @JsonProperty("took_ms")
    private long tookMs;

    public static IndexingReportResponse from(IndexingReport report) {
        IndexingReportResponse response = new IndexingReportResponse();
        response.setTotal(report.getTotal());
        response.setIndexed(report.count(DocumentState.INDEXED));
        response.setFailed(report.count(DocumentState.FAILED));
        response.setSkipped(report.count(DocumentState.SKIPPED));
        response.setFailedIds(report.getFailedIds());
        response.setSkippedIds(report.getSkippedIds());
        response.setTookMs(report.getTookMs());
        return response;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getIndexed() {
        return indexed;
    }

    public void setIndexed(int indexed) {
        this.indexed = indexed;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }

    public int getSkipped() {
        return skipped;
    }

    public void setSkipped(int skipped) {
        this.skipped = skipped;
    }

    public List<String> getFailedIds() {
        return failedIds;
    }

    public void setFailedIds(List<String> failedIds) {
        this.failedIds = failedIds;
    }

    public List<String> getSkippedIds() {
        return skippedIds;
    }

    public void setSkippedIds(List<String> skippedIds) {
        this.skippedIds = skippedIds;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }
}
