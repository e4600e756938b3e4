package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SectionContent(
    String source,

    @JsonProperty("revision_id")
    String revisionId,

    @JsonProperty("version_label")
    String versionLabel,

    @JsonProperty("section_ref")
    String sectionRef,

    String text,

    @JsonProperty("page_numbers")
    List<Integer> pageNumbers
) {}
