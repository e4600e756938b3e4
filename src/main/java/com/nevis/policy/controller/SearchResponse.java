package com.nevis.policy.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.policy.model.ChunkMatch;

import java.time.LocalDate;
import java.util.List;

public record SearchResponse(
    String query,

    @JsonProperty("as_of")
    LocalDate asOf,

    List<ChunkMatch> results
) {}
