package com.nevis.policy.model;

import java.time.LocalDate;

public record RevisionUpdate(
    String versionLabel,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    boolean openEnded,
    String notes
) {}
