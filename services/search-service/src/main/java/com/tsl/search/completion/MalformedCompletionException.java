package com.tsl.search.completion;

public class MalformedCompletionException extends RuntimeException {
    public MalformedCompletionException(String message) {
        super(message);
    }

    public MalformedCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
