package com.tsl.search.query;

public class QueryRewriteCancelledException extends RuntimeException {
    public QueryRewriteCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
