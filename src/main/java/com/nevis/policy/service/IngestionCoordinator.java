package com.nevis.policy.service;

import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionDeletion;
import com.nevis.policy.model.RevisionStatusView;

public interface IngestionCoordinator {

    // never throws, failures are recorded on the revision
    void ingest(String revisionId);

    boolean isRunning(String revisionId);

    PolicyRevision reindex(String revisionId);

    void purge(RevisionDeletion deletion);

    void retag(String revisionId);

    RevisionStatusView progress(String revisionId);
}
