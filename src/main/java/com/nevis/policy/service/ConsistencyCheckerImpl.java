package com.nevis.policy.service;

import com.nevis.policy.model.ConsistencyReport;
import com.nevis.policy.model.ConsistencyReport.MissingIndexData;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatus;
import com.nevis.policy.repository.SimilarityIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencyCheckerImpl implements ConsistencyChecker {

    private final PolicyRegistry registry;
    private final SimilarityIndex similarityIndex;
    private final Clock clock;

    @Override
    public ConsistencyReport check() {
        Map<String, Integer> counts = similarityIndex.countsByRevision();

        List<MissingIndexData> missing = new ArrayList<>();
        for (PolicyRevision revision : registry.listIndexedRevisions()) {
            if (counts.getOrDefault(revision.revisionId(), 0) == 0) {
                missing.add(new MissingIndexData(revision.source(), revision.revisionId(), revision.status()));
            }
        }

        Map<String, Integer> orphaned = new LinkedHashMap<>();
        Map<String, Integer> failedWithVectors = new LinkedHashMap<>();
        counts.forEach((revisionId, count) -> {
            Optional<PolicyRevision> revision = registry.findRevision(revisionId);
            if (revision.isEmpty()) {
                orphaned.put(revisionId, count);
            } else if (revision.get().status() == RevisionStatus.FAILED) {
                // the purge after a failed run did not go through
                failedWithVectors.put(revisionId, count);
            }
        });

        ConsistencyReport report = new ConsistencyReport(missing, orphaned, failedWithVectors, clock.instant());
        log.debug("Consistency check: {} missing, {} orphaned, {} failed with vectors",
            missing.size(), orphaned.size(), failedWithVectors.size());
        return report;
    }
}
