package com.tsl.search.service;

public class TotalRetrievalFailureException extends RuntimeException {
    public TotalRetrievalFailureException(String message) {
        super(message);
    }
}
