package com.tsl.search.extract;

import com.tsl.search.model.StructuredFields;

public final class ExtractionResult {
    private final StructuredFields fields;
    private final ExtractionOutcome outcome;
    private final int attempts;
    private final String reason;

    public ExtractionResult(StructuredFields fields, ExtractionOutcome outcome, int attempts, String reason) {
        this.fields = fields == null ? StructuredFields.empty() : fields;
        this.outcome = outcome;
        this.attempts = attempts;
        this.reason = reason;
    }

    public StructuredFields getFields() {
        return fields;
    }

    public ExtractionOutcome getOutcome() {
        return outcome;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }
}
