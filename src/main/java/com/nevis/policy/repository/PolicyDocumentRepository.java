package com.nevis.policy.repository;

import com.nevis.policy.model.DocumentUpdate;
import com.nevis.policy.model.PolicyCategory;
import com.nevis.policy.model.PolicyDocument;

import java.util.List;
import java.util.Optional;

public interface PolicyDocumentRepository {

    PolicyDocument save(PolicyDocument document);

    Optional<PolicyDocument> findBySource(String source);

    boolean existsBySource(String source);

    List<PolicyDocument> findAll(PolicyCategory category, String sourcePrefix);

    Optional<PolicyDocument> update(String source, DocumentUpdate update);

    /**
     * Takes the document's row lock for the rest of the transaction and bumps its timeline version.
     *
     * @return the new version, or empty when the document does not exist
     */
    Optional<Long> lockTimeline(String source);

    Optional<Long> findTimelineVersion(String source);
}
