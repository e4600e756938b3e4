package com.nevis.policy.ingest;

import java.util.List;

public record ProcessedDocument(int pageCount, List<EmbeddedChunk> chunks) {}
