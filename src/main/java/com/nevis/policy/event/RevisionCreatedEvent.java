package com.nevis.policy.event;

public record RevisionCreatedEvent(String source, String revisionId) {}
