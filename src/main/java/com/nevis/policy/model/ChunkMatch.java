package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record ChunkMatch(
    @JsonProperty("chunk_id")
    String chunkId,

    String text,

    double score,

    String source,

    @JsonProperty("revision_id")
    String revisionId,

    @JsonProperty("version_label")
    String versionLabel,

    @JsonProperty("effective_from")
    LocalDate effectiveFrom,

    @JsonProperty("effective_to")
    LocalDate effectiveTo,

    @JsonProperty("section_ref")
    String sectionRef,

    @JsonProperty("page_number")
    Integer pageNumber
) {}
