package com.nevis.policy.worker;

import com.nevis.policy.model.ConsistencyReport;
import com.nevis.policy.service.ConsistencyChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ConsistencyAuditWorker {

    private final ConsistencyChecker consistencyChecker;

    @Scheduled(
        initialDelayString = "${app.consistency.initial-delay-ms:60000}",
        fixedDelayString = "${app.consistency.audit-interval-ms:3600000}"
    )
    public void audit() {
        log.debug("Starting consistency audit...");

        ConsistencyReport report = consistencyChecker.check();
        if (report.healthy()) {
            log.debug("Consistency audit clean");
            return;
        }

        report.missingIndexData().forEach(missing ->
            log.warn("Revision {} of {} is {} but has no vectors", missing.revisionId(), missing.source(),
                missing.status().value()));
        report.orphanedVectors().forEach((revisionId, count) ->
            log.warn("{} orphaned vectors tagged with unknown revision {}", count, revisionId));
        report.failedWithVectors().forEach((revisionId, count) ->
            log.warn("Revision {} failed ingestion but still has {} vectors", revisionId, count));
    }
}
