package com.nevis.policy.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.policy.model.EffectiveSnapshot;

import java.time.LocalDate;
import java.util.List;

public record EffectiveSnapshotResponse(
    LocalDate date,

    List<EffectiveRevisionResponse> policies,

    @JsonProperty("not_yet_effective")
    List<String> notYetEffective,

    @JsonProperty("in_gap")
    List<String> inGap,

    @JsonProperty("no_revisions")
    List<String> noRevisions
) {

    public static EffectiveSnapshotResponse from(EffectiveSnapshot snapshot) {
        return new EffectiveSnapshotResponse(
            snapshot.date(),
            snapshot.inForce().stream()
                .map(source -> EffectiveRevisionResponse.from(snapshot.resolutions().get(source)))
                .toList(),
            snapshot.notYetEffective(),
            snapshot.inGap(),
            snapshot.withoutRevisions()
        );
    }
}
