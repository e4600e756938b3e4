package com.nevis.policy.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatus;

import java.time.LocalDate;

public record TimelineEntry(
    @JsonProperty("revision_id")
    String revisionId,

    @JsonProperty("version_label")
    String versionLabel,

    @JsonProperty("effective_from")
    LocalDate effectiveFrom,

    @JsonProperty("effective_to")
    LocalDate effectiveTo,

    RevisionStatus status
) {

    public static TimelineEntry of(PolicyRevision revision) {
        return new TimelineEntry(
            revision.revisionId(),
            revision.versionLabel(),
            revision.effectiveFrom(),
            revision.effectiveTo(),
            revision.status()
        );
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTo == null || !date.isAfter(effectiveTo));
    }
}
