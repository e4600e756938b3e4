package com.nevis.policy.service;

import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.index.RevisionTimeline;
import com.nevis.policy.model.EffectiveSnapshot;
import com.nevis.policy.model.Resolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class EffectiveDateResolver {

    private final PolicyRegistry registry;

    public Resolution resolve(String source, LocalDate date) {
        Resolution resolution = registry.timeline(source).resolve(date);
        log.debug("Resolved {} on {} -> {}", source, date, resolution.outcome());
        return resolution;
    }

    public EffectiveSnapshot resolveSnapshot(LocalDate date) {
        Map<String, Resolution> resolutions = new LinkedHashMap<>();
        List<String> inForce = new ArrayList<>();
        List<String> notYetEffective = new ArrayList<>();
        List<String> inGap = new ArrayList<>();
        List<String> withoutRevisions = new ArrayList<>();

        for (String source : registry.sources()) {
            Resolution resolution = registry.timeline(source).resolve(date);
            resolutions.put(source, resolution);
            switch (resolution.outcome()) {
                case IN_FORCE -> inForce.add(source);
                case NOT_YET_EFFECTIVE -> notYetEffective.add(source);
                case GAP -> inGap.add(source);
                case NO_REVISIONS -> withoutRevisions.add(source);
            }
        }

        return new EffectiveSnapshot(date, resolutions, inForce, notYetEffective, inGap, withoutRevisions);
    }

    public Set<String> revisionIdsFor(LocalDate date, Collection<String> sources) {
        Collection<String> candidates = sources != null ? sources : registry.sources();
        Set<String> revisionIds = new LinkedHashSet<>();
        for (String source : candidates) {
            RevisionTimeline timeline;
            try {
                timeline = registry.timeline(source);
            } catch (EntityNotFoundException e) {
                log.debug("Ignoring unknown source {} in temporal filter", source);
                continue;
            }
            Resolution resolution = timeline.resolve(date);
            if (resolution.isInForce()) {
                revisionIds.add(resolution.revision().revisionId());
            }
        }
        return revisionIds;
    }
}
