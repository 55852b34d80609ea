package com.tsl.search.embed;

public class EmbeddingUnavailableException extends RuntimeException {
    private final boolean retryable;

    public EmbeddingUnavailableException(String message) {
        this(message, true);
    }

    public EmbeddingUnavailableException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        this(message, true, cause);
    }

    public EmbeddingUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
