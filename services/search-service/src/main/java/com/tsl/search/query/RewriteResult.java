package com.tsl.search.query;

import com.tsl.search.model.StructuredFilter;

public final class RewriteResult {
    private final StructuredFilter filter;
    private final boolean degraded;
    private final int attempts;
    private final String reason;

    public RewriteResult(StructuredFilter filter, boolean degraded, int attempts, String reason) {
        this.filter = filter == null ? StructuredFilter.unconstrained() : filter;
        this.degraded = degraded;
        this.attempts = attempts;
        this.reason = reason;
    }

    public static RewriteResult skipped() {
        return new RewriteResult(StructuredFilter.unconstrained(), false, 0, null);
    }

    public static RewriteResult degraded(int attempts, String reason) {
        return new RewriteResult(StructuredFilter.unconstrained(), true, attempts, reason);
    }

    public StructuredFilter getFilter() {
        return filter;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }
}
