package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record Supersession(
    @JsonProperty("superseded_revision_id")
    String supersededRevisionId,

    @JsonProperty("effective_to")
    LocalDate newEffectiveTo
) {}
