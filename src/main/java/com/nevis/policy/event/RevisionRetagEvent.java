package com.nevis.policy.event;

public record RevisionRetagEvent(String revisionId) {}
