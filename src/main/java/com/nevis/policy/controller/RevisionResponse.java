package com.nevis.policy.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatus;

import java.time.LocalDate;
import java.time.OffsetDateTime;

public record RevisionResponse(
    @JsonProperty("revision_id")
    String revisionId,

    String source,

    @JsonProperty("version_label")
    String versionLabel,

    @JsonProperty("effective_from")
    LocalDate effectiveFrom,

    @JsonProperty("effective_to")
    LocalDate effectiveTo,

    RevisionStatus status,

    @JsonProperty("chunk_count")
    int chunkCount,

    @JsonProperty("page_count")
    Integer pageCount,

    @JsonProperty("file_size_bytes")
    Long fileSizeBytes,

    String notes,

    String error,

    @JsonProperty("superseded_by")
    String supersededBy,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("ingested_at")
    OffsetDateTime ingestedAt
) {

    public static RevisionResponse from(PolicyRevision revision) {
        if (revision == null) {
            return null;
        }
        return new RevisionResponse(
            revision.revisionId(),
            revision.source(),
            revision.versionLabel(),
            revision.effectiveFrom(),
            revision.effectiveTo(),
            revision.status(),
            revision.chunkCount(),
            revision.pageCount(),
            revision.fileSizeBytes(),
            revision.notes(),
            revision.error(),
            revision.supersededBy(),
            revision.createdAt(),
            revision.ingestedAt()
        );
    }
}
