package com.tsl.search.index;

public class IndexCorruptionException extends RuntimeException {
    public IndexCorruptionException(String message) {
        super(message);
    }

    public IndexCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
