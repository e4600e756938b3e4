package com.nevis.policy.repository;

import com.nevis.policy.model.ChunkMatch;
import com.nevis.policy.model.PolicyChunk;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface SimilarityIndex {

    void upsert(List<PolicyChunk> chunks);

    int deleteByRevision(String revisionId);

    int retag(String revisionId, String versionLabel, LocalDate effectiveFrom, LocalDate effectiveTo);

    /**
     * Nearest chunks to {@code vector}. A null filter means "no restriction"; an empty one matches nothing.
     */
    List<ChunkMatch> query(float[] vector, Collection<String> sources, Collection<String> revisionIds,
                           int limit, double minScore);

    // sectionRef is compared ignoring case
    List<ChunkMatch> findSection(String source, String revisionId, String sectionRef);

    Map<String, Integer> countsByRevision();
}
