package com.nevis.policy.model;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;

// a null effectiveTo is open-ended; both bounds are inclusive
public record PolicyRevision(
    String revisionId,
    String source,
    String versionLabel,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    RevisionStatus status,
    String fileReference,
    Long fileSizeBytes,
    Integer pageCount,
    int chunkCount,
    String notes,
    String error,
    String supersededBy,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    OffsetDateTime ingestedAt
) {

    public boolean isOpenEnded() {
        return effectiveTo == null;
    }

    public boolean isInForceOn(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || !date.isAfter(effectiveTo));
    }

    public boolean hasSameTemporalTags(PolicyRevision other) {
        return effectiveFrom.equals(other.effectiveFrom)
            && Objects.equals(effectiveTo, other.effectiveTo)
            && Objects.equals(versionLabel, other.versionLabel);
    }
}
