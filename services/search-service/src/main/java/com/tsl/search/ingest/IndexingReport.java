package com.tsl.search.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class IndexingReport {
    private final int total;
    private final Map<DocumentState, Integer> counts;
    private final List<String> failedIds;
    private final List<String> skippedIds;
    private final long tookMs;

    public IndexingReport(List<DocumentStatus> statuses, long tookMs) {
        Map<DocumentState, Integer> byState = new EnumMap<>(DocumentState.class);
        List<String> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (DocumentStatus status : statuses) {
            byState.merge(status.getState(), 1, Integer::sum);
            if (status.getState() == DocumentState.FAILED) {
                failed.add(status.getDocId());
            } else if (status.getState() == DocumentState.SKIPPED) {
                skipped.add(status.getDocId());
            }
        }
        this.total = statuses.size();
        this.counts = Collections.unmodifiableMap(byState);
        this.failedIds = Collections.unmodifiableList(failed);
        this.skippedIds = Collections.unmodifiableList(skipped);
        this.tookMs = tookMs;
    }

    public int getTotal() {
        return total;
    }

    public int count(DocumentState state) {
        return counts.getOrDefault(state, 0);
    }

    public Map<DocumentState, Integer> getCounts() {
        return counts;
    }

    public List<String> getFailedIds() {
        return failedIds;
    }

    public List<String> getSkippedIds() {
        return skippedIds;
    }

    public long getTookMs() {
        return tookMs;
    }
}
