package com.nevis.policy.model;

import java.time.OffsetDateTime;

public record PolicyDocument(
    String source,
    String title,
    String description,
    PolicyCategory category,
    long timelineVersion,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
