package com.nevis.policy.service;

import com.nevis.policy.config.SearchProperties;
import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.exception.SectionNotFoundException;
import com.nevis.policy.exception.WrongQueryException;
import com.nevis.policy.model.ChunkMatch;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.Resolution;
import com.nevis.policy.model.SectionContent;
import com.nevis.policy.repository.SimilarityIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TemporalSearchServiceImpl implements TemporalSearchService {

    private static final int MIN_QUERY_LENGTH = 3;
    private static final int MAX_QUERY_LENGTH = 500;

    private final EffectiveDateResolver resolver;
    private final PolicyRegistry registry;
    private final SimilarityIndex similarityIndex;
    private final EmbeddingService embeddingService;
    private final SearchProperties properties;

    @Override
    public List<ChunkMatch> search(String query, List<String> sources, LocalDate asOfDate, Integer limit) {
        validateQuery(query);
        int effectiveLimit = clampLimit(limit);
        List<String> sourceFilter = sources == null || sources.isEmpty() ? null : List.copyOf(sources);

        Set<String> revisionIds = null;
        if (asOfDate != null) {
            revisionIds = resolver.revisionIdsFor(asOfDate, sourceFilter);
            if (revisionIds.isEmpty()) {
                log.debug("No revision in force on {} for {}, returning no results", asOfDate, sourceFilter);
                return List.of();
            }
        }

        log.debug("Semantic search: query='{}', sources={}, asOf={}, limit={}", query, sourceFilter, asOfDate,
            effectiveLimit);

        float[] vector = embeddingService.embedQuery(query);
        return similarityIndex.query(vector, sourceFilter, revisionIds, effectiveLimit, properties.minScore());
    }

    @Override
    public SectionContent getSection(String source, String sectionRef, String revisionId, LocalDate today) {
        if (sectionRef == null || sectionRef.isBlank()) {
            throw new WrongQueryException("Section reference is required");
        }

        String targetRevision = revisionId;
        if (targetRevision == null) {
            Resolution resolution = resolver.resolve(source, today);
            if (!resolution.isInForce()) {
                throw new SectionNotFoundException(source, sectionRef,
                    "No revision of %s in force on %s".formatted(source, today));
            }
            targetRevision = resolution.revision().revisionId();
        } else {
            PolicyRevision revision = registry.getRevision(targetRevision);
            if (!revision.source().equals(source)) {
                throw EntityNotFoundException.revision(targetRevision);
            }
        }

        List<ChunkMatch> chunks = similarityIndex.findSection(source, targetRevision, sectionRef.trim());
        if (chunks.isEmpty()) {
            throw new SectionNotFoundException(source, sectionRef,
                "Section '%s' not found in %s".formatted(sectionRef, targetRevision));
        }

        String text = chunks.stream().map(ChunkMatch::text).collect(Collectors.joining("\n\n"));
        List<Integer> pages = chunks.stream()
            .map(ChunkMatch::pageNumber)
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .toList();

        return new SectionContent(source, targetRevision, chunks.get(0).versionLabel(), sectionRef.trim(), text, pages);
    }

    private int clampLimit(Integer limit) {
        if (limit == null) {
            return properties.defaultLimit();
        }
        return Math.max(1, Math.min(limit, properties.maxLimit()));
    }

    private void validateQuery(String query) {
        if (query == null || query.trim().length() < MIN_QUERY_LENGTH) {
            throw new WrongQueryException("Query too short");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new WrongQueryException("Query too long");
        }
    }
}
