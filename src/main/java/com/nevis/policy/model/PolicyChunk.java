package com.nevis.policy.model;

import java.time.LocalDate;

public record PolicyChunk(
    String chunkId,
    String source,
    String revisionId,
    String versionLabel,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    String sectionRef,
    Integer pageNumber,
    int chunkIndex,
    String content,
    float[] embedding
) {

    public static String chunkId(String source, String revisionId, String sectionRef, int chunkIndex) {
        String section = sectionRef == null || sectionRef.isBlank()
            ? "body"
            : sectionRef.trim().replaceAll("[^A-Za-z0-9]+", "_");
        return "%s__%s__%s__%03d".formatted(source, revisionId, section, chunkIndex);
    }
}
