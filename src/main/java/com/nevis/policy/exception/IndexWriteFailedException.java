package com.nevis.policy.exception;

public class IndexWriteFailedException extends IngestionException {

    public IndexWriteFailedException(String message, Throwable cause) {
        super("INDEX_WRITE_FAILED", message, cause);
    }
}
