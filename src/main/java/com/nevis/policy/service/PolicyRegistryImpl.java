package com.nevis.policy.service;

import com.nevis.policy.event.RevisionCreatedEvent;
import com.nevis.policy.event.RevisionDeletedEvent;
import com.nevis.policy.event.RevisionRetagEvent;
import com.nevis.policy.exception.CannotDeleteSoleRevisionException;
import com.nevis.policy.exception.DocumentAlreadyExistsException;
import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.exception.IngestionInProgressException;
import com.nevis.policy.index.RevisionIndex;
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
import com.nevis.policy.model.RevisionStatus;
import com.nevis.policy.model.RevisionUpdate;
import com.nevis.policy.model.Supersession;
import com.nevis.policy.repository.PolicyDocumentRepository;
import com.nevis.policy.repository.PolicyRevisionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyRegistryImpl implements PolicyRegistry {

    private final PolicyDocumentRepository documentRepository;
    private final PolicyRevisionRepository revisionRepository;
    private final RevisionIndex revisionIndex;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public PolicyDocument createDocument(String source, String title, String description, PolicyCategory category) {
        PolicySlugs.requireValidSource(source);
        Objects.requireNonNull(category, "category is required");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }

        if (documentRepository.existsBySource(source)) {
            throw new DocumentAlreadyExistsException(source);
        }

        PolicyDocument saved;
        try {
            saved = documentRepository.save(new PolicyDocument(source, title, description, category, 0L, null, null));
        } catch (DuplicateKeyException e) {
            throw new DocumentAlreadyExistsException(source);
        }

        publishAfterCommit(RevisionTimeline.empty(source, saved.timelineVersion()));
        log.info("Registered policy {} ({})", source, category.value());
        return saved;
    }

    @Override
    @Transactional
    public PolicyDocument updateDocument(String source, DocumentUpdate update) {
        return documentRepository.update(source, update)
            .orElseThrow(() -> EntityNotFoundException.document(source));
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentDetail getDocument(String source, LocalDate today) {
        log.debug("Fetching policy {}", source);

        PolicyDocument document = documentRepository.findBySource(source)
            .orElseThrow(() -> {
                log.warn("Policy not found: {}", source);
                return EntityNotFoundException.document(source);
            });

        List<PolicyRevision> revisions = revisionRepository.findBySource(source).stream()
            .sorted(Comparator.comparing(PolicyRevision::effectiveFrom).reversed())
            .toList();

        PolicyRevision current = revisions.stream()
            .filter(revision -> revision.isInForceOn(today))
            .findFirst()
            .orElse(null);

        return new DocumentDetail(document, revisions, current);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DocumentSummary> listDocuments(PolicyCategory category, String sourcePrefix, LocalDate today) {
        return documentRepository.findAll(category, sourcePrefix).stream()
            .map(document -> {
                List<PolicyRevision> revisions = revisionRepository.findBySource(document.source());
                PolicyRevision current = revisions.stream()
                    .filter(revision -> revision.isInForceOn(today))
                    .findFirst()
                    .orElse(null);
                return new DocumentSummary(document, current, revisions.size());
            })
            .toList();
    }

    @Override
    @Transactional
    public RevisionCreation createRevision(NewRevision request) {
        String source = request.source();
        if (request.versionLabel() == null || request.versionLabel().isBlank()) {
            throw new IllegalArgumentException("version_label is required");
        }

        long version = documentRepository.lockTimeline(source)
            .orElseThrow(() -> EntityNotFoundException.document(source));

        List<PolicyRevision> existing = revisionRepository.findBySource(source);
        Optional<Supersession> supersession =
            TimelineRules.planInsert(source, existing, request.effectiveFrom(), request.effectiveTo());

        String revisionId = nextRevisionId(source, request.effectiveFrom());

        supersession.ifPresent(plan ->
            revisionRepository.supersede(plan.supersededRevisionId(), plan.newEffectiveTo(), revisionId));

        PolicyRevision created = revisionRepository.save(new PolicyRevision(
            revisionId,
            source,
            request.versionLabel(),
            request.effectiveFrom(),
            request.effectiveTo(),
            RevisionStatus.PROCESSING,
            request.fileReference(),
            request.fileSizeBytes(),
            null,
            0,
            request.notes(),
            null,
            null,
            null,
            null,
            null
        ));

        publishAfterCommit(RevisionTimeline.of(source, version, revisionRepository.findBySource(source)));

        eventPublisher.publishEvent(new RevisionCreatedEvent(source, revisionId));
        supersession.ifPresent(plan -> {
            log.info("Revision {} superseded {} (effective_to -> {})",
                revisionId, plan.supersededRevisionId(), plan.newEffectiveTo());
            eventPublisher.publishEvent(new RevisionRetagEvent(plan.supersededRevisionId()));
        });

        log.info("Created revision {} of {} effective {}..{}", revisionId, source,
            request.effectiveFrom(), request.effectiveTo() == null ? "open" : request.effectiveTo());
        return new RevisionCreation(created, supersession.orElse(null));
    }

    @Override
    @Transactional
    public PolicyRevision updateRevision(String revisionId, RevisionUpdate update) {
        PolicyRevision current = getRevision(revisionId);
        String source = current.source();
        long version = documentRepository.lockTimeline(source)
            .orElseThrow(() -> EntityNotFoundException.document(source));

        // re-read under the lock
        current = getRevision(revisionId);

        LocalDate effectiveFrom = update.effectiveFrom() != null ? update.effectiveFrom() : current.effectiveFrom();
        LocalDate effectiveTo = update.openEnded()
            ? null
            : update.effectiveTo() != null ? update.effectiveTo() : current.effectiveTo();
        String versionLabel = update.versionLabel() != null ? update.versionLabel() : current.versionLabel();
        String notes = update.notes() != null ? update.notes() : current.notes();

        boolean datesChanged = !effectiveFrom.equals(current.effectiveFrom())
            || !Objects.equals(effectiveTo, current.effectiveTo());

        if (datesChanged) {
            TimelineRules.checkUpdate(source, revisionRepository.findBySource(source), revisionId,
                effectiveFrom, effectiveTo);
        }

        PolicyRevision updated = revisionRepository.updateDetails(revisionId, versionLabel, effectiveFrom,
            effectiveTo, notes);

        publishAfterCommit(RevisionTimeline.of(source, version, revisionRepository.findBySource(source)));

        if (!updated.hasSameTemporalTags(current)) {
            eventPublisher.publishEvent(new RevisionRetagEvent(revisionId));
        }

        log.info("Updated revision {} of {}", revisionId, source);
        return updated;
    }

    @Override
    @Transactional
    public RevisionDeletion deleteRevision(String revisionId) {
        PolicyRevision revision = getRevision(revisionId);
        String source = revision.source();
        long version = documentRepository.lockTimeline(source)
            .orElseThrow(() -> EntityNotFoundException.document(source));

        List<PolicyRevision> revisions = revisionRepository.findBySource(source);
        if (revisions.stream().noneMatch(r -> r.revisionId().equals(revisionId))) {
            throw EntityNotFoundException.revision(revisionId);
        }
        if (revisions.size() == 1) {
            log.warn("Refusing to delete {}: sole revision of {}", revisionId, source);
            throw new CannotDeleteSoleRevisionException(source, revisionId);
        }

        revisionRepository.delete(revisionId);
        revisionRepository.clearSupersededBy(revisionId);

        publishAfterCommit(RevisionTimeline.of(source, version, revisionRepository.findBySource(source)));

        RevisionDeletion deletion = new RevisionDeletion(source, revisionId, revision.chunkCount(),
            revision.fileReference());
        eventPublisher.publishEvent(new RevisionDeletedEvent(deletion));

        log.info("Deleted revision {} of {}", revisionId, source);
        return deletion;
    }

    @Override
    @Transactional(readOnly = true)
    public PolicyRevision getRevision(String revisionId) {
        return revisionRepository.findById(revisionId)
            .orElseThrow(() -> EntityNotFoundException.revision(revisionId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PolicyRevision> findRevision(String revisionId) {
        return revisionRepository.findById(revisionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PolicyRevision> listRevisions(String source) {
        if (!documentRepository.existsBySource(source)) {
            throw EntityNotFoundException.document(source);
        }
        return revisionRepository.findBySource(source);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PolicyRevision> listIndexedRevisions() {
        return revisionRepository.findByStatusIn(EnumSet.of(RevisionStatus.ACTIVE, RevisionStatus.SUPERSEDED));
    }

    @Override
    @Transactional(readOnly = true)
    public RevisionTimeline timeline(String source) {
        return revisionIndex.find(source).orElseGet(() -> {
            log.debug("Timeline cache miss for {}, rebuilding", source);
            RevisionTimeline rebuilt = loadTimeline(source);
            revisionIndex.publish(rebuilt);
            return rebuilt;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> sources() {
        Set<String> sources = new LinkedHashSet<>();
        documentRepository.findAll(null, null).forEach(document -> sources.add(document.source()));
        return sources;
    }

    @Override
    @Transactional
    public Optional<PolicyRevision> markIngested(String revisionId, String fileReference, int chunkCount,
                                                 Integer pageCount) {
        return transition(revisionId,
            () -> revisionRepository.markIngested(revisionId, fileReference, chunkCount, pageCount));
    }

    @Override
    @Transactional
    public Optional<PolicyRevision> markFailed(String revisionId, String fileReference, String error) {
        return transition(revisionId, () -> revisionRepository.markFailed(revisionId, fileReference, error));
    }

    @Override
    @Transactional
    public PolicyRevision beginReindex(String revisionId) {
        PolicyRevision revision = getRevision(revisionId);
        if (revision.status() == RevisionStatus.PROCESSING) {
            throw new IngestionInProgressException(revisionId);
        }

        return transition(revisionId, () -> revisionRepository.claimForReindex(revisionId))
            .orElseThrow(() -> revisionRepository.existsById(revisionId)
                ? new IngestionInProgressException(revisionId)
                : EntityNotFoundException.revision(revisionId));
    }

    @Override
    @Transactional(readOnly = true)
    public void rebuildIndex() {
        revisionIndex.clear();
        Set<String> sources = sources();
        sources.forEach(source -> revisionIndex.publish(loadTimeline(source)));
        log.info("Revision index rebuilt for {} policies", sources.size());
    }

    private Optional<PolicyRevision> transition(String revisionId,
                                                Supplier<Optional<PolicyRevision>> change) {
        Optional<PolicyRevision> existing = revisionRepository.findById(revisionId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        String source = existing.get().source();
        Optional<Long> version = documentRepository.lockTimeline(source);
        if (version.isEmpty()) {
            return Optional.empty();
        }

        Optional<PolicyRevision> changed = change.get();
        if (changed.isPresent()) {
            publishAfterCommit(RevisionTimeline.of(source, version.get(), revisionRepository.findBySource(source)));
            log.info("Revision {} is now {}", revisionId, changed.get().status().value());
        }
        return changed;
    }

    // a revision moved off its start date keeps its id, so the derived id may already be taken
    private String nextRevisionId(String source, LocalDate effectiveFrom) {
        String base = PolicySlugs.revisionId(source, effectiveFrom);
        String candidate = base;
        for (int suffix = 2; revisionRepository.existsById(candidate); suffix++) {
            candidate = base + "_" + suffix;
        }
        return candidate;
    }

    /**
     * Reads the version before the revisions: a commit landing in between yields newer rows under an
     * older version, which the next publication replaces.
     */
    private RevisionTimeline loadTimeline(String source) {
        long version = documentRepository.findTimelineVersion(source)
            .orElseThrow(() -> EntityNotFoundException.document(source));
        return RevisionTimeline.of(source, version, revisionRepository.findBySource(source));
    }

    private void publishAfterCommit(RevisionTimeline timeline) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    revisionIndex.publish(timeline);
                }
            });
        } else {
            revisionIndex.publish(timeline);
        }
    }
}
