package com.nevis.policy.model;

public record RevisionDeletion(
    String source,
    String revisionId,
    int chunkCount,
    String fileReference
) {}
