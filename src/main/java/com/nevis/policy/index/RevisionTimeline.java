package com.nevis.policy.index;

import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.Resolution;
import com.nevis.policy.model.ResolutionOutcome;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

public final class RevisionTimeline {

    private final String source;
    private final long version;
    private final NavigableMap<LocalDate, TimelineEntry> entries;

    private RevisionTimeline(String source, long version, NavigableMap<LocalDate, TimelineEntry> entries) {
        this.source = source;
        this.version = version;
        this.entries = Collections.unmodifiableNavigableMap(entries);
    }

    public static RevisionTimeline empty(String source, long version) {
        return new RevisionTimeline(source, version, new TreeMap<>());
    }

    public static RevisionTimeline of(String source, long version, Collection<PolicyRevision> revisions) {
        NavigableMap<LocalDate, TimelineEntry> map = new TreeMap<>();
        for (PolicyRevision revision : revisions) {
            TimelineEntry previous = map.put(revision.effectiveFrom(), TimelineEntry.of(revision));
            if (previous != null) {
                throw new IllegalStateException("Two revisions of %s start on %s: %s and %s"
                    .formatted(source, revision.effectiveFrom(), previous.revisionId(), revision.revisionId()));
            }
        }
        return new RevisionTimeline(source, version, map);
    }

    public Resolution resolve(LocalDate date) {
        if (entries.isEmpty()) {
            return new Resolution(source, date, ResolutionOutcome.NO_REVISIONS, null);
        }
        Map.Entry<LocalDate, TimelineEntry> floor = entries.floorEntry(date);
        if (floor == null) {
            return new Resolution(source, date, ResolutionOutcome.NOT_YET_EFFECTIVE, null);
        }
        TimelineEntry candidate = floor.getValue();
        if (candidate.covers(date)) {
            return new Resolution(source, date, ResolutionOutcome.IN_FORCE, candidate);
        }
        return new Resolution(source, date, ResolutionOutcome.GAP, null);
    }

    public String source() {
        return source;
    }

    public long version() {
        return version;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<TimelineEntry> entries() {
        return new ArrayList<>(entries.values());
    }
}
