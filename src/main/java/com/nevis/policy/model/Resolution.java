package com.nevis.policy.model;

import com.nevis.policy.index.TimelineEntry;

import java.time.LocalDate;

public record Resolution(
    String source,
    LocalDate date,
    ResolutionOutcome outcome,
    TimelineEntry revision
) {

    public boolean isInForce() {
        return outcome == ResolutionOutcome.IN_FORCE;
    }
}
