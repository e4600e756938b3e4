package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ConsistencyReport(
    @JsonProperty("missing_index_data")
    List<MissingIndexData> missingIndexData,

    @JsonProperty("orphaned_vectors")
    Map<String, Integer> orphanedVectors,

    @JsonProperty("failed_with_vectors")
    Map<String, Integer> failedWithVectors,

    @JsonProperty("checked_at")
    Instant checkedAt
) {

    @JsonProperty("healthy")
    public boolean healthy() {
        return missingIndexData.isEmpty() && orphanedVectors.isEmpty() && failedWithVectors.isEmpty();
    }

    public record MissingIndexData(
        String source,

        @JsonProperty("revision_id")
        String revisionId,

        RevisionStatus status
    ) {}
}
