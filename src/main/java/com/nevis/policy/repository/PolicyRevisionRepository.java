package com.nevis.policy.repository;

import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PolicyRevisionRepository {

    PolicyRevision save(PolicyRevision revision);

    Optional<PolicyRevision> findById(String revisionId);

    List<PolicyRevision> findBySource(String source);

    List<PolicyRevision> findByStatusIn(Collection<RevisionStatus> statuses);

    boolean existsById(String revisionId);

    List<PolicyRevision> findStaleProcessing(int staleThresholdMinutes);

    PolicyRevision updateDetails(String revisionId, String versionLabel, LocalDate effectiveFrom,
                                 LocalDate effectiveTo, String notes);

    void supersede(String revisionId, LocalDate effectiveTo, String supersededBy);

    void clearSupersededBy(String supersededBy);

    void delete(String revisionId);

    /**
     * Finalizes a successful ingestion. Only applies while the revision is still {@code processing}
     * and still registered with {@code fileReference}, the file the run read.
     */
    Optional<PolicyRevision> markIngested(String revisionId, String fileReference, int chunkCount, Integer pageCount);

    Optional<PolicyRevision> markFailed(String revisionId, String fileReference, String error);

    Optional<PolicyRevision> claimForReindex(String revisionId);
}
