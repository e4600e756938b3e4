package com.nevis.policy.service;

import com.nevis.policy.model.ChunkMatch;
import com.nevis.policy.model.SectionContent;

import java.time.LocalDate;
import java.util.List;

public interface TemporalSearchService {

    List<ChunkMatch> search(String query, List<String> sources, LocalDate asOfDate, Integer limit);

    SectionContent getSection(String source, String sectionRef, String revisionId, LocalDate today);
}
