package com.nevis.policy.model;

public record RevisionCreation(
    PolicyRevision revision,
    Supersession supersession
) {}
