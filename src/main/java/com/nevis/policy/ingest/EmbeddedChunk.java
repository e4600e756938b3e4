package com.nevis.policy.ingest;

public record EmbeddedChunk(
    int chunkIndex,
    String text,
    String sectionRef,
    Integer pageNumber,
    float[] embedding
) {}
