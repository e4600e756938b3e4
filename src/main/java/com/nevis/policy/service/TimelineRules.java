package com.nevis.policy.service;

import com.nevis.policy.exception.InvalidDateRangeException;
import com.nevis.policy.exception.RevisionOverlapException;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.Supersession;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;

public final class TimelineRules {

    private TimelineRules() {
    }

    /**
     * Validates a new revision against the existing ones.
     *
     * @return the open-ended revision to close, if the new revision supersedes one
     * @throws RevisionOverlapException when the new range collides with an existing revision
     */
    public static Optional<Supersession> planInsert(String source, Collection<PolicyRevision> existing,
                                                    LocalDate effectiveFrom, LocalDate effectiveTo) {
        checkRange(effectiveFrom, effectiveTo);

        Supersession supersession = null;
        for (PolicyRevision current : existing) {
            if (current.isOpenEnded()) {
                if (effectiveTo != null && effectiveTo.isBefore(current.effectiveFrom())) {
                    continue;
                }
                if (!effectiveFrom.isAfter(current.effectiveFrom())) {
                    throw overlap(source, current, effectiveFrom, effectiveTo);
                }
                if (effectiveTo != null) {
                    // bounded revisions never close an open-ended one
                    throw overlap(source, current, effectiveFrom, effectiveTo);
                }
                supersession = new Supersession(current.revisionId(), effectiveFrom.minusDays(1));
            } else if (overlaps(effectiveFrom, effectiveTo, current.effectiveFrom(), current.effectiveTo())) {
                throw overlap(source, current, effectiveFrom, effectiveTo);
            }
        }
        return Optional.ofNullable(supersession);
    }

    public static void checkUpdate(String source, Collection<PolicyRevision> existing, String revisionId,
                                   LocalDate effectiveFrom, LocalDate effectiveTo) {
        checkRange(effectiveFrom, effectiveTo);

        for (PolicyRevision other : existing) {
            if (other.revisionId().equals(revisionId)) {
                continue;
            }
            if (overlaps(effectiveFrom, effectiveTo, other.effectiveFrom(), other.effectiveTo())) {
                throw overlap(source, other, effectiveFrom, effectiveTo);
            }
        }
    }

    public static boolean overlaps(LocalDate aFrom, LocalDate aTo, LocalDate bFrom, LocalDate bTo) {
        boolean aStartsAfterB = bTo != null && aFrom.isAfter(bTo);
        boolean bStartsAfterA = aTo != null && bFrom.isAfter(aTo);
        return !aStartsAfterB && !bStartsAfterA;
    }

    private static void checkRange(LocalDate effectiveFrom, LocalDate effectiveTo) {
        if (effectiveFrom == null) {
            throw new IllegalArgumentException("effective_from is required");
        }
        if (effectiveTo != null && effectiveTo.isBefore(effectiveFrom)) {
            throw new InvalidDateRangeException(effectiveFrom, effectiveTo);
        }
    }

    private static RevisionOverlapException overlap(String source, PolicyRevision conflicting,
                                                    LocalDate effectiveFrom, LocalDate effectiveTo) {
        return new RevisionOverlapException(source, conflicting.revisionId(),
            "Range %s..%s overlaps revision %s (%s..%s) of %s".formatted(
                effectiveFrom, effectiveTo == null ? "open" : effectiveTo,
                conflicting.revisionId(), conflicting.effectiveFrom(),
                conflicting.effectiveTo() == null ? "open" : conflicting.effectiveTo(),
                source));
    }
}
