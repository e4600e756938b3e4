package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RevisionStatusView(
    String source,

    @JsonProperty("revision_id")
    String revisionId,

    RevisionStatus status,

    @JsonProperty("chunk_count")
    int chunkCount,

    String error,

    IngestionProgress progress
) {}
