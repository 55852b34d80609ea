package com.tsl.search.retrieval;

import com.tsl.search.model.RankedEntry;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public class RetrievalStageResult {
    public enum Status {
        SUCCESS,
        ERROR,
        TIMED_OUT,
        SKIPPED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final List<RankedEntry> entries;
    private final Status status;
    private final long tookMs;
    private final String errorMessage;

    private RetrievalStageResult(List<RankedEntry> entries, Status status, long tookMs, String errorMessage) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
        this.status = status;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static RetrievalStageResult success(List<RankedEntry> entries, long tookMs) {
        return new RetrievalStageResult(entries, Status.SUCCESS, tookMs, null);
    }

    public static RetrievalStageResult empty() {
        return new RetrievalStageResult(Collections.emptyList(), Status.SUCCESS, 0L, null);
    }

    public static RetrievalStageResult error(String message) {
        return new RetrievalStageResult(Collections.emptyList(), Status.ERROR, 0L, message);
    }

    public static RetrievalStageResult timedOut() {
        return new RetrievalStageResult(Collections.emptyList(), Status.TIMED_OUT, 0L, "timeout");
    }

    public static RetrievalStageResult skipped(String reason) {
        return new RetrievalStageResult(Collections.emptyList(), Status.SKIPPED, 0L, reason);
    }

    public RetrievalStageResult withEntries(List<RankedEntry> filtered) {
        return new RetrievalStageResult(filtered, status, tookMs, errorMessage);
    }

    public List<RankedEntry> getEntries() {
        return entries;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isError() {
        return status == Status.ERROR || status == Status.TIMED_OUT;
    }

    public boolean isTimedOut() {
        return status == Status.TIMED_OUT;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
