package com.tsl.search.index;

public class IndexWriteException extends RuntimeException {
    public IndexWriteException(String message) {
        super(message);
    }

    public IndexWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
