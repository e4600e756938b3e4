package com.nevis.policy.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record UpdateRevisionRequest(
    @JsonProperty("version_label")
    String versionLabel,

    @JsonProperty("effective_from")
    LocalDate effectiveFrom,

    @JsonProperty("effective_to")
    LocalDate effectiveTo,

    @JsonProperty("open_ended")
    Boolean openEnded,

    String notes
) {}
