package com.nevis.policy.repository;

import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatus;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPolicyRevisionRepository implements PolicyRevisionRepository {

    private final Map<String, PolicyRevision> revisions = new ConcurrentHashMap<>();

    @Override
    public PolicyRevision save(PolicyRevision revision) {
        OffsetDateTime now = OffsetDateTime.now();
        PolicyRevision stored = copy(revision, revision.status() != null ? revision.status() : RevisionStatus.PROCESSING,
            revision.effectiveFrom(), revision.effectiveTo(), revision.versionLabel(), revision.notes(),
            revision.chunkCount(), revision.pageCount(), revision.error(), revision.supersededBy(), now, null);
        if (revisions.putIfAbsent(revision.revisionId(), stored) != null) {
            throw new DuplicateKeyException("policy_revisions_pkey");
        }
        return stored;
    }

    @Override
    public Optional<PolicyRevision> findById(String revisionId) {
        return Optional.ofNullable(revisions.get(revisionId));
    }

    @Override
    public List<PolicyRevision> findBySource(String source) {
        return revisions.values().stream()
            .filter(revision -> revision.source().equals(source))
            .sorted(Comparator.comparing(PolicyRevision::effectiveFrom))
            .toList();
    }

    @Override
    public List<PolicyRevision> findByStatusIn(Collection<RevisionStatus> statuses) {
        return revisions.values().stream()
            .filter(revision -> statuses.contains(revision.status()))
            .sorted(Comparator.comparing(PolicyRevision::source).thenComparing(PolicyRevision::effectiveFrom))
            .toList();
    }

    @Override
    public boolean existsById(String revisionId) {
        return revisions.containsKey(revisionId);
    }

    @Override
    public List<PolicyRevision> findStaleProcessing(int staleThresholdMinutes) {
        OffsetDateTime threshold = OffsetDateTime.now().minusMinutes(staleThresholdMinutes);
        return revisions.values().stream()
            .filter(revision -> revision.status() == RevisionStatus.PROCESSING)
            .filter(revision -> revision.updatedAt().isBefore(threshold))
            .toList();
    }

    @Override
    public PolicyRevision updateDetails(String revisionId, String versionLabel, LocalDate effectiveFrom,
                                        LocalDate effectiveTo, String notes) {
        PolicyRevision current = findById(revisionId).orElseThrow(() -> EntityNotFoundException.revision(revisionId));
        PolicyRevision updated = copy(current, current.status(), effectiveFrom, effectiveTo, versionLabel, notes,
            current.chunkCount(), current.pageCount(), current.error(), current.supersededBy(),
            current.createdAt(), current.ingestedAt());
        revisions.put(revisionId, updated);
        return updated;
    }

    @Override
    public void supersede(String revisionId, LocalDate effectiveTo, String supersededBy) {
        PolicyRevision current = findById(revisionId).orElseThrow(() -> EntityNotFoundException.revision(revisionId));
        RevisionStatus status = current.status() == RevisionStatus.ACTIVE ? RevisionStatus.SUPERSEDED : current.status();
        revisions.put(revisionId, copy(current, status, current.effectiveFrom(), effectiveTo, current.versionLabel(),
            current.notes(), current.chunkCount(), current.pageCount(), current.error(), supersededBy,
            current.createdAt(), current.ingestedAt()));
    }

    @Override
    public void clearSupersededBy(String supersededBy) {
        revisions.replaceAll((id, current) -> supersededBy.equals(current.supersededBy())
            ? copy(current, current.status(), current.effectiveFrom(), current.effectiveTo(), current.versionLabel(),
                current.notes(), current.chunkCount(), current.pageCount(), current.error(), null,
                current.createdAt(), current.ingestedAt())
            : current);
    }

    @Override
    public void delete(String revisionId) {
        if (revisions.remove(revisionId) == null) {
            throw EntityNotFoundException.revision(revisionId);
        }
    }

    @Override
    public Optional<PolicyRevision> markIngested(String revisionId, String fileReference, int chunkCount,
                                                 Integer pageCount) {
        PolicyRevision current = revisions.get(revisionId);
        if (!isProcessing(current, fileReference)) {
            return Optional.empty();
        }
        RevisionStatus status = current.supersededBy() == null ? RevisionStatus.ACTIVE : RevisionStatus.SUPERSEDED;
        PolicyRevision updated = copy(current, status, current.effectiveFrom(), current.effectiveTo(),
            current.versionLabel(), current.notes(), chunkCount, pageCount, null, current.supersededBy(),
            current.createdAt(), OffsetDateTime.now());
        revisions.put(revisionId, updated);
        return Optional.of(updated);
    }

    @Override
    public Optional<PolicyRevision> markFailed(String revisionId, String fileReference, String error) {
        PolicyRevision current = revisions.get(revisionId);
        if (!isProcessing(current, fileReference)) {
            return Optional.empty();
        }
        PolicyRevision updated = copy(current, RevisionStatus.FAILED, current.effectiveFrom(), current.effectiveTo(),
            current.versionLabel(), current.notes(), 0, current.pageCount(), error, current.supersededBy(),
            current.createdAt(), current.ingestedAt());
        revisions.put(revisionId, updated);
        return Optional.of(updated);
    }

    private static boolean isProcessing(PolicyRevision current, String fileReference) {
        return current != null
            && current.status() == RevisionStatus.PROCESSING
            && Objects.equals(current.fileReference(), fileReference);
    }

    @Override
    public Optional<PolicyRevision> claimForReindex(String revisionId) {
        PolicyRevision current = revisions.get(revisionId);
        if (current == null || current.status() == RevisionStatus.PROCESSING) {
            return Optional.empty();
        }
        PolicyRevision updated = copy(current, RevisionStatus.PROCESSING, current.effectiveFrom(),
            current.effectiveTo(), current.versionLabel(), current.notes(), current.chunkCount(), current.pageCount(),
            null, current.supersededBy(), current.createdAt(), current.ingestedAt());
        revisions.put(revisionId, updated);
        return Optional.of(updated);
    }

    public void forceStatus(String revisionId, RevisionStatus status) {
        PolicyRevision current = revisions.get(revisionId);
        revisions.put(revisionId, copy(current, status, current.effectiveFrom(), current.effectiveTo(),
            current.versionLabel(), current.notes(), current.chunkCount(), current.pageCount(), current.error(),
            current.supersededBy(), current.createdAt(), current.ingestedAt()));
    }

    private static PolicyRevision copy(PolicyRevision base, RevisionStatus status, LocalDate effectiveFrom,
                                       LocalDate effectiveTo, String versionLabel, String notes, int chunkCount,
                                       Integer pageCount, String error, String supersededBy,
                                       OffsetDateTime createdAt, OffsetDateTime ingestedAt) {
        return new PolicyRevision(
            base.revisionId(),
            base.source(),
            versionLabel,
            effectiveFrom,
            effectiveTo,
            status,
            base.fileReference(),
            base.fileSizeBytes(),
            pageCount,
            chunkCount,
            notes,
            error,
            supersededBy,
            createdAt,
            OffsetDateTime.now(),
            ingestedAt
        );
    }
}
