package com.tsl.search.ingest;

public final class DocumentStatus {
    private final String docId;
    private final DocumentState state;
    private final String reason;
    private final long updatedAtMs;

    public DocumentStatus(String docId, DocumentState state, String reason, long updatedAtMs) {
        this.docId = docId;
        this.state = state;
        this.reason = reason;
        this.updatedAtMs = updatedAtMs;
    }

    public String getDocId() {
        return docId;
    }

    public DocumentState getState() {
        return state;
    }

    public String getReason() {
        return reason;
    }

    public long getUpdatedAtMs() {
        return updatedAtMs;
    }

    @Override
    public String toString() {
        return docId + ":" + state + (reason == null ? "" : "(" + reason + ")");
    }
}
