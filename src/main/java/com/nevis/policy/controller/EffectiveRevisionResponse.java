package com.nevis.policy.controller;

import com.nevis.policy.index.TimelineEntry;
import com.nevis.policy.model.Resolution;
import com.nevis.policy.model.ResolutionOutcome;

import java.time.LocalDate;

public record EffectiveRevisionResponse(
    String source,
    LocalDate date,
    ResolutionOutcome outcome,
    TimelineEntry revision
) {

    public static EffectiveRevisionResponse from(Resolution resolution) {
        return new EffectiveRevisionResponse(resolution.source(), resolution.date(), resolution.outcome(),
            resolution.revision());
    }
}
