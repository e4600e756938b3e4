package com.nevis.policy.model;

public enum IngestionPhase {
    PENDING,
    EXTRACTING,
    EMBEDDING,
    WRITING,
    FINALIZING,
    COMPLETE,
    FAILED
}
