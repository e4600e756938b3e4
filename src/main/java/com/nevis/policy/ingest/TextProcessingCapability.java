package com.nevis.policy.ingest;

public interface TextProcessingCapability {

    ProcessedDocument process(byte[] content, IngestionListener listener);
}
