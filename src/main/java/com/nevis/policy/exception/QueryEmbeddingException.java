package com.nevis.policy.exception;

public class QueryEmbeddingException extends RuntimeException {

    public QueryEmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
