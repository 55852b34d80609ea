package com.tsl.search.index;

import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class IndexHealth {
    private final AtomicReference<String> inconsistentReason = new AtomicReference<>();

    public boolean isConsistent() {
        return inconsistentReason.get() == null;
    }

    public void markInconsistent(String reason) {
        inconsistentReason.set(reason == null || reason.isBlank() ? "index_inconsistent" : reason);
    }

    public void markHealthy() {
        inconsistentReason.set(null);
    }

    public String getReason() {
        return inconsistentReason.get();
    }

    public void ensureConsistent() {
        String reason = inconsistentReason.get();
        if (reason != null) {
            throw new IndexUnavailableException(reason);
        }
    }
}
