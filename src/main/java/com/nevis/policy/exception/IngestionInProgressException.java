package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class IngestionInProgressException extends RuntimeException {
    private final String revisionId;

    public IngestionInProgressException(String revisionId) {
        super("Ingestion already in progress for revision " + revisionId);
        this.revisionId = revisionId;
    }
}
