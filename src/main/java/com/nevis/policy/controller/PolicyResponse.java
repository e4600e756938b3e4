package com.nevis.policy.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.policy.model.DocumentDetail;
import com.nevis.policy.model.DocumentSummary;
import com.nevis.policy.model.PolicyCategory;
import com.nevis.policy.model.PolicyDocument;

import java.time.OffsetDateTime;
import java.util.List;

public record PolicyResponse(
    String source,

    String title,

    String description,

    PolicyCategory category,

    @JsonProperty("current_revision")
    RevisionResponse currentRevision,

    @JsonProperty("revision_count")
    Integer revisionCount,

    List<RevisionResponse> revisions,

    @JsonProperty("created_at")
    OffsetDateTime createdAt,

    @JsonProperty("updated_at")
    OffsetDateTime updatedAt
) {

    public static PolicyResponse from(PolicyDocument document) {
        return new PolicyResponse(document.source(), document.title(), document.description(), document.category(),
            null, null, null, document.createdAt(), document.updatedAt());
    }

    public static PolicyResponse from(DocumentSummary summary) {
        PolicyDocument document = summary.document();
        return new PolicyResponse(document.source(), document.title(), document.description(), document.category(),
            RevisionResponse.from(summary.currentRevision()), summary.revisionCount(), null,
            document.createdAt(), document.updatedAt());
    }

    public static PolicyResponse from(DocumentDetail detail) {
        PolicyDocument document = detail.document();
        return new PolicyResponse(document.source(), document.title(), document.description(), document.category(),
            RevisionResponse.from(detail.currentRevision()), detail.revisions().size(),
            detail.revisions().stream().map(RevisionResponse::from).toList(),
            document.createdAt(), document.updatedAt());
    }
}
