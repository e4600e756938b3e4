package com.nevis.policy.listener;

import com.nevis.policy.event.RevisionCreatedEvent;
import com.nevis.policy.event.RevisionDeletedEvent;
import com.nevis.policy.event.RevisionReindexEvent;
import com.nevis.policy.event.RevisionRetagEvent;
import com.nevis.policy.service.IngestionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class RevisionEventListener {

    private final IngestionCoordinator ingestionCoordinator;

    @Async("ingestionTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleCreated(RevisionCreatedEvent event) {
        log.info("Starting async ingestion of {} ({})", event.revisionId(), event.source());
        ingestionCoordinator.ingest(event.revisionId());
    }

    @Async("ingestionTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleReindex(RevisionReindexEvent event) {
        log.info("Starting async reindex of {} ({})", event.revisionId(), event.source());
        ingestionCoordinator.ingest(event.revisionId());
    }

    @Async("ingestionTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleRetag(RevisionRetagEvent event) {
        ingestionCoordinator.retag(event.revisionId());
    }

    @Async("ingestionTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleDeleted(RevisionDeletedEvent event) {
        ingestionCoordinator.purge(event.deletion());
    }
}
