package com.tsl.search.extract;

public class ExtractionCancelledException extends RuntimeException {
    public ExtractionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
