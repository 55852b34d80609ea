package com.tsl.search.completion;

public class CompletionUnavailableException extends RuntimeException {
    private final boolean retryable;

    public CompletionUnavailableException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public CompletionUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
