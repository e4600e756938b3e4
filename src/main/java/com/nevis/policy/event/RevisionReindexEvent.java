package com.nevis.policy.event;

public record RevisionReindexEvent(String source, String revisionId) {}
