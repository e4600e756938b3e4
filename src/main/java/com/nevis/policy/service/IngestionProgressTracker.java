package com.nevis.policy.service;

import com.nevis.policy.model.IngestionPhase;
import com.nevis.policy.model.IngestionProgress;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class IngestionProgressTracker {

    private final Map<String, IngestionProgress> progress = new ConcurrentHashMap<>();
    private final Clock clock;

    public IngestionProgressTracker(Clock clock) {
        this.clock = clock;
    }

    public void start(String revisionId) {
        progress.put(revisionId, new IngestionProgress(IngestionPhase.PENDING, 0, 0, 0, clock.instant()));
    }

    public void phase(String revisionId, IngestionPhase phase) {
        progress.compute(revisionId, (id, current) -> {
            int processed = current != null ? current.chunksProcessed() : 0;
            int total = current != null ? current.chunksTotal() : 0;
            return new IngestionProgress(phase, percent(phase, processed, total), processed, total, clock.instant());
        });
    }

    public void chunks(String revisionId, int processed, int total) {
        progress.compute(revisionId, (id, current) -> {
            IngestionPhase phase = current != null ? current.phase() : IngestionPhase.EMBEDDING;
            return new IngestionProgress(phase, percent(phase, processed, total), processed, total, clock.instant());
        });
    }

    public Optional<IngestionProgress> get(String revisionId) {
        return Optional.ofNullable(progress.get(revisionId));
    }

    public void clear(String revisionId) {
        progress.remove(revisionId);
    }

    // extraction 0-10%, embedding 10-80%, writing 80-95%, finalizing 95-100%
    static int percent(IngestionPhase phase, int processed, int total) {
        return switch (phase) {
            case PENDING -> 0;
            case EXTRACTING -> 5;
            case EMBEDDING -> 10 + (total > 0 ? 70 * processed / total : 0);
            case WRITING -> 80 + (total > 0 ? 15 * processed / total : 0);
            case FINALIZING -> 95;
            case COMPLETE -> 100;
            case FAILED -> 0;
        };
    }
}
