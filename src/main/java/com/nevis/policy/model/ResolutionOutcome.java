package com.nevis.policy.model;

public enum ResolutionOutcome {
    IN_FORCE,
    NOT_YET_EFFECTIVE,
    GAP,
    NO_REVISIONS
}
