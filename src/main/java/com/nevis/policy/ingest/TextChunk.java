package com.nevis.policy.ingest;

public record TextChunk(int chunkIndex, String text, String sectionRef, int pageNumber) {}
