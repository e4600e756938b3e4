package com.nevis.policy.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.policy.model.RevisionDeletion;

public record RevisionDeletedResponse(
    String source,

    @JsonProperty("revision_id")
    String revisionId,

    @JsonProperty("chunks_to_remove")
    int chunksToRemove
) {

    public static RevisionDeletedResponse from(RevisionDeletion deletion) {
        return new RevisionDeletedResponse(deletion.source(), deletion.revisionId(), deletion.chunkCount());
    }
}
