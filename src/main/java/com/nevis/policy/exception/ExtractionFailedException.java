package com.nevis.policy.exception;

public class ExtractionFailedException extends IngestionException {

    public ExtractionFailedException(String message) {
        super("EXTRACTION_FAILED", message, null);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super("EXTRACTION_FAILED", message, cause);
    }
}
