package com.nevis.policy.controller;

import com.nevis.policy.model.ChunkMatch;
import com.nevis.policy.model.SectionContent;
import com.nevis.policy.service.TemporalSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequiredArgsConstructor
public class SearchController {

    private final TemporalSearchService searchService;
    private final Clock clock;

    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "source", required = false) List<String> sources,
        @RequestParam(name = "as_of", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
        @RequestParam(name = "limit", required = false) Integer limit) {

        List<ChunkMatch> results = searchService.search(query, sources, asOf, limit);
        return ResponseEntity.ok(new SearchResponse(query, asOf, results));
    }

    @GetMapping("/policies/{source}/sections")
    public ResponseEntity<SectionContent> getSection(
        @PathVariable String source,
        @RequestParam(name = "ref") String sectionRef,
        @RequestParam(name = "revision_id", required = false) String revisionId) {

        return ResponseEntity.ok(searchService.getSection(source, sectionRef, revisionId, LocalDate.now(clock)));
    }
}
