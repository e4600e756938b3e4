package com.nevis.policy.worker;

import com.nevis.policy.event.RevisionReindexEvent;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.repository.PolicyRevisionRepository;
import com.nevis.policy.service.IngestionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class StaleIngestionWorker {

    private final PolicyRevisionRepository revisionRepository;
    private final IngestionCoordinator ingestionCoordinator;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${app.ingestion.stale-threshold-minutes:30}")
    private int staleThresholdMinutes;

    @Scheduled(
        initialDelayString = "${app.ingestion.stale-check-initial-delay-ms:30000}",
        fixedDelayString = "${app.ingestion.stale-check-interval-ms:300000}"
    )
    @Transactional
    public void resumeStaleIngestions() {
        log.debug("Checking for revisions stuck in processing...");

        List<PolicyRevision> stale = revisionRepository.findStaleProcessing(staleThresholdMinutes).stream()
            .filter(revision -> !ingestionCoordinator.isRunning(revision.revisionId()))
            .toList();

        if (stale.isEmpty()) {
            return;
        }

        log.info("Found {} revisions stuck in processing for over {} minutes. Re-triggering ingestion...",
            stale.size(), staleThresholdMinutes);

        stale.forEach(revision ->
            eventPublisher.publishEvent(new RevisionReindexEvent(revision.source(), revision.revisionId())));
    }
}
