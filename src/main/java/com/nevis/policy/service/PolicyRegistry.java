package com.nevis.policy.service;

import com.nevis.policy.index.RevisionTimeline;
import com.nevis.policy.model.DocumentDetail;
import com.nevis.policy.model.DocumentSummary;
import com.nevis.policy.model.DocumentUpdate;
import com.nevis.policy.model.NewRevision;
import com.nevis.policy.model.PolicyCategory;
import com.nevis.policy.model.PolicyDocument;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionCreation;
import com.nevis.policy.model.RevisionDeletion;
import com.nevis.policy.model.RevisionUpdate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface PolicyRegistry {

    PolicyDocument createDocument(String source, String title, String description, PolicyCategory category);

    PolicyDocument updateDocument(String source, DocumentUpdate update);

    DocumentDetail getDocument(String source, LocalDate today);

    List<DocumentSummary> listDocuments(PolicyCategory category, String sourcePrefix, LocalDate today);

    RevisionCreation createRevision(NewRevision request);

    PolicyRevision updateRevision(String revisionId, RevisionUpdate update);

    RevisionDeletion deleteRevision(String revisionId);

    PolicyRevision getRevision(String revisionId);

    Optional<PolicyRevision> findRevision(String revisionId);

    List<PolicyRevision> listRevisions(String source);

    List<PolicyRevision> listIndexedRevisions();

    RevisionTimeline timeline(String source);

    Set<String> sources();

    Optional<PolicyRevision> markIngested(String revisionId, String fileReference, int chunkCount, Integer pageCount);

    Optional<PolicyRevision> markFailed(String revisionId, String fileReference, String error);

    PolicyRevision beginReindex(String revisionId);

    void rebuildIndex();
}
