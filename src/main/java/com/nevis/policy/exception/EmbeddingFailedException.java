package com.nevis.policy.exception;

public class EmbeddingFailedException extends IngestionException {

    public EmbeddingFailedException(String message, Throwable cause) {
        super("EMBEDDING_FAILED", message, cause);
    }
}
