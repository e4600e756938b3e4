package com.nevis.policy.model;

import java.time.LocalDate;

public record NewRevision(
    String source,
    String versionLabel,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    String fileReference,
    Long fileSizeBytes,
    String notes
) {}
