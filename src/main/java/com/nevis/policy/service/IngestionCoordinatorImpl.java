package com.nevis.policy.service;

import com.nevis.policy.config.IngestionProperties;
import com.nevis.policy.event.RevisionReindexEvent;
import com.nevis.policy.exception.ExtractionFailedException;
import com.nevis.policy.exception.IndexWriteFailedException;
import com.nevis.policy.exception.IngestionException;
import com.nevis.policy.ingest.EmbeddedChunk;
import com.nevis.policy.ingest.IngestionListener;
import com.nevis.policy.ingest.ProcessedDocument;
import com.nevis.policy.ingest.RevisionFileStore;
import com.nevis.policy.ingest.TextProcessingCapability;
import com.nevis.policy.model.IngestionPhase;
import com.nevis.policy.model.PolicyChunk;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionDeletion;
import com.nevis.policy.model.RevisionStatus;
import com.nevis.policy.model.RevisionStatusView;
import com.nevis.policy.repository.SimilarityIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionCoordinatorImpl implements IngestionCoordinator {

    private final PolicyRegistry registry;
    private final SimilarityIndex similarityIndex;
    private final TextProcessingCapability capability;
    private final RevisionFileStore fileStore;
    private final IngestionProgressTracker tracker;
    private final IngestionProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    private final Set<String> running = new HashSet<>();
    private final Set<String> requeued = new HashSet<>();

    @Override
    public void ingest(String revisionId) {
        if (!tryStart(revisionId)) {
            log.info("Ingestion of {} already running in this process, queued to run again after it", revisionId);
            return;
        }

        do {
            runOnce(revisionId);
        } while (continueWithRequeued(revisionId));
    }

    @Override
    public boolean isRunning(String revisionId) {
        synchronized (running) {
            return running.contains(revisionId);
        }
    }

    private boolean tryStart(String revisionId) {
        synchronized (running) {
            if (running.add(revisionId)) {
                return true;
            }
            requeued.add(revisionId);
            return false;
        }
    }

    // keeps the running slot when another trigger arrived during the run
    private boolean continueWithRequeued(String revisionId) {
        synchronized (running) {
            if (requeued.remove(revisionId)) {
                return true;
            }
            running.remove(revisionId);
            return false;
        }
    }

    private void runOnce(String revisionId) {
        PolicyRevision revision = null;
        try {
            Optional<PolicyRevision> found = registry.findRevision(revisionId);
            if (found.isEmpty()) {
                log.warn("Revision {} no longer exists, nothing to ingest", revisionId);
                return;
            }
            revision = found.get();
            if (revision.status() != RevisionStatus.PROCESSING) {
                log.warn("Revision {} is {}, not processing; skipping", revisionId, revision.status().value());
                return;
            }

            runPipeline(revision);
        } catch (IngestionException e) {
            log.error("Ingestion of {} failed: {}", revisionId, e.describe());
            fail(revision, e.describe());
        } catch (RuntimeException e) {
            log.error("Ingestion of {} failed unexpectedly", revisionId, e);
            if (revision != null) {
                fail(revision, "INGESTION_FAILED: " + e.getMessage());
            }
        }
    }

    private void runPipeline(PolicyRevision revision) {
        String revisionId = revision.revisionId();
        long started = System.currentTimeMillis();
        tracker.start(revisionId);

        // a previous run may have left vectors behind
        int stale = similarityIndex.deleteByRevision(revisionId);
        if (stale > 0) {
            log.info("Removed {} stale vectors of {} before ingestion", stale, revisionId);
        }

        byte[] content;
        try {
            content = fileStore.read(revision.fileReference());
        } catch (RuntimeException e) {
            throw new ExtractionFailedException("Source file unavailable: " + e.getMessage(), e);
        }

        ProcessedDocument processed = capability.process(content, new IngestionListener() {
            @Override
            public void onPhase(IngestionPhase phase) {
                tracker.phase(revisionId, phase);
            }

            @Override
            public void onProgress(int done, int total) {
                tracker.chunks(revisionId, done, total);
            }
        });

        List<EmbeddedChunk> chunks = processed.chunks();
        if (chunks.isEmpty()) {
            throw new ExtractionFailedException("No chunks produced");
        }

        write(revision, chunks);

        tracker.phase(revisionId, IngestionPhase.FINALIZING);
        Optional<PolicyRevision> finalized = registry.markIngested(revisionId, revision.fileReference(),
            chunks.size(), processed.pageCount());

        if (finalized.isEmpty()) {
            Optional<PolicyRevision> now = registry.findRevision(revisionId);
            if (now.isEmpty()) {
                log.warn("Revision {} was deleted during ingestion, purging its vectors", revisionId);
                similarityIndex.deleteByRevision(revisionId);
            } else if (!Objects.equals(now.get().fileReference(), revision.fileReference())) {
                // the queued run for the new registration replaces these vectors
                log.warn("Revision {} was re-registered with another file during ingestion, not finalizing",
                    revisionId);
            } else {
                log.warn("Revision {} left processing during ingestion (now {}), not finalizing",
                    revisionId, now.get().status().value());
            }
            tracker.clear(revisionId);
            return;
        }

        PolicyRevision done = finalized.get();
        if (!done.hasSameTemporalTags(revision)) {
            log.info("Dates of {} changed during ingestion, retagging", revisionId);
            similarityIndex.retag(revisionId, done.versionLabel(), done.effectiveFrom(), done.effectiveTo());
        }

        tracker.phase(revisionId, IngestionPhase.COMPLETE);
        log.info("Ingested {}: {} chunks from {} pages in {} ms, status {}", revisionId, chunks.size(),
            processed.pageCount(), System.currentTimeMillis() - started, done.status().value());
    }

    private void write(PolicyRevision revision, List<EmbeddedChunk> chunks) {
        String revisionId = revision.revisionId();
        tracker.phase(revisionId, IngestionPhase.WRITING);
        tracker.chunks(revisionId, 0, chunks.size());

        int batchSize = properties.writeBatchSize();
        for (int start = 0; start < chunks.size(); start += batchSize) {
            List<PolicyChunk> batch = chunks.subList(start, Math.min(start + batchSize, chunks.size())).stream()
                .map(chunk -> toPolicyChunk(revision, chunk))
                .toList();
            try {
                similarityIndex.upsert(batch);
            } catch (RuntimeException e) {
                throw new IndexWriteFailedException(
                    "Write of batch starting at chunk %d failed: %s".formatted(start, e.getMessage()), e);
            }
            tracker.chunks(revisionId, start + batch.size(), chunks.size());
        }
    }

    private static PolicyChunk toPolicyChunk(PolicyRevision revision, EmbeddedChunk chunk) {
        return new PolicyChunk(
            PolicyChunk.chunkId(revision.source(), revision.revisionId(), chunk.sectionRef(), chunk.chunkIndex()),
            revision.source(),
            revision.revisionId(),
            revision.versionLabel(),
            revision.effectiveFrom(),
            revision.effectiveTo(),
            chunk.sectionRef() != null ? chunk.sectionRef() : "",
            chunk.pageNumber(),
            chunk.chunkIndex(),
            chunk.text(),
            chunk.embedding()
        );
    }

    private void fail(PolicyRevision revision, String error) {
        String revisionId = revision.revisionId();
        tracker.phase(revisionId, IngestionPhase.FAILED);
        try {
            int purged = similarityIndex.deleteByRevision(revisionId);
            log.info("Purged {} partial vectors of {}", purged, revisionId);
        } catch (RuntimeException e) {
            // still marked failed; the consistency audit reports failed revisions that keep vectors
            log.error("Could not purge partial vectors of {}", revisionId, e);
        }
        if (registry.markFailed(revisionId, revision.fileReference(), error).isEmpty()) {
            log.warn("Revision {} was no longer processing this file when marking it failed", revisionId);
        }
    }

    @Override
    @Transactional
    public PolicyRevision reindex(String revisionId) {
        PolicyRevision revision = registry.beginReindex(revisionId);
        eventPublisher.publishEvent(new RevisionReindexEvent(revision.source(), revisionId));
        log.info("Reindex of {} requested", revisionId);
        return revision;
    }

    @Override
    public void purge(RevisionDeletion deletion) {
        String revisionId = deletion.revisionId();
        if (registry.findRevision(revisionId).isPresent()) {
            // recreated under the same id since deletion; its own ingestion rewrites the vectors
            log.warn("Revision {} exists again, skipping vector purge", revisionId);
        } else {
            int removed = similarityIndex.deleteByRevision(revisionId);
            log.info("Purged {} vectors of deleted revision {}", removed, revisionId);
        }
        tracker.clear(revisionId);

        if (deletion.fileReference() != null) {
            fileStore.delete(deletion.fileReference());
        }
    }

    @Override
    public void retag(String revisionId) {
        registry.findRevision(revisionId).ifPresentOrElse(
            revision -> {
                int updated = similarityIndex.retag(revisionId, revision.versionLabel(),
                    revision.effectiveFrom(), revision.effectiveTo());
                log.info("Retagged {} vectors of {} to {}..{}", updated, revisionId, revision.effectiveFrom(),
                    revision.effectiveTo() == null ? "open" : revision.effectiveTo());
            },
            () -> log.debug("Revision {} is gone, nothing to retag", revisionId)
        );
    }

    @Override
    public RevisionStatusView progress(String revisionId) {
        PolicyRevision revision = registry.getRevision(revisionId);
        return new RevisionStatusView(
            revision.source(),
            revisionId,
            revision.status(),
            revision.chunkCount(),
            revision.error(),
            tracker.get(revisionId).orElse(null)
        );
    }
}
