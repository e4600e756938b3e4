package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IngestionProgress(
    IngestionPhase phase,

    @JsonProperty("percent_complete")
    int percentComplete,

    @JsonProperty("chunks_processed")
    int chunksProcessed,

    @JsonProperty("chunks_total")
    int chunksTotal,

    @JsonProperty("updated_at")
    Instant updatedAt
) {}
