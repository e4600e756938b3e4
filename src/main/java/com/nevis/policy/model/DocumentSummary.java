package com.nevis.policy.model;

public record DocumentSummary(
    PolicyDocument document,
    PolicyRevision currentRevision,
    int revisionCount
) {}
