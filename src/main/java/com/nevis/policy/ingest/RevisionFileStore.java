package com.nevis.policy.ingest;

public interface RevisionFileStore {

    String store(String source, String revisionKey, String originalFilename, byte[] content);

    byte[] read(String fileReference);

    void delete(String fileReference);
}
