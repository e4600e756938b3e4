package com.nevis.policy.controller;

import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.RevisionStatusView;
import com.nevis.policy.model.RevisionUpdate;
import com.nevis.policy.service.IngestionCoordinator;
import com.nevis.policy.service.PolicyRegistry;
import com.nevis.policy.service.RevisionIntakeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/policies/{source}/revisions")
@RequiredArgsConstructor
public class RevisionController {

    private final PolicyRegistry registry;
    private final IngestionCoordinator ingestionCoordinator;
    private final RevisionIntakeService intakeService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RevisionCreatedResponse> createRevision(
        @PathVariable String source,
        @RequestPart("file") MultipartFile file,
        @RequestParam("version_label") String versionLabel,
        @RequestParam("effective_from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate effectiveFrom,
        @RequestParam(name = "effective_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate effectiveTo,
        @RequestParam(name = "notes", required = false) String notes) throws IOException {

        var creation = intakeService.submit(source, versionLabel, effectiveFrom, effectiveTo, notes,
            file.getOriginalFilename(), file.getBytes());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RevisionCreatedResponse.from(creation));
    }

    @GetMapping
    public ResponseEntity<List<RevisionResponse>> listRevisions(@PathVariable String source) {
        return ResponseEntity.ok(registry.listRevisions(source).stream().map(RevisionResponse::from).toList());
    }

    @GetMapping("/{revisionId}")
    public ResponseEntity<RevisionResponse> getRevision(@PathVariable String source, @PathVariable String revisionId) {
        return ResponseEntity.ok(RevisionResponse.from(revisionOf(source, revisionId)));
    }

    @PatchMapping("/{revisionId}")
    public ResponseEntity<RevisionResponse> updateRevision(
        @PathVariable String source,
        @PathVariable String revisionId,
        @Valid @RequestBody UpdateRevisionRequest request) {

        revisionOf(source, revisionId);
        PolicyRevision updated = registry.updateRevision(revisionId, new RevisionUpdate(
            request.versionLabel(),
            request.effectiveFrom(),
            request.effectiveTo(),
            Boolean.TRUE.equals(request.openEnded()),
            request.notes()
        ));
        return ResponseEntity.ok(RevisionResponse.from(updated));
    }

    @DeleteMapping("/{revisionId}")
    public ResponseEntity<RevisionDeletedResponse> deleteRevision(
        @PathVariable String source,
        @PathVariable String revisionId) {

        revisionOf(source, revisionId);
        return ResponseEntity.ok(RevisionDeletedResponse.from(registry.deleteRevision(revisionId)));
    }

    @GetMapping("/{revisionId}/status")
    public ResponseEntity<RevisionStatusView> getStatus(
        @PathVariable String source,
        @PathVariable String revisionId) {

        revisionOf(source, revisionId);
        return ResponseEntity.ok(ingestionCoordinator.progress(revisionId));
    }

    @PostMapping("/{revisionId}/reindex")
    public ResponseEntity<RevisionResponse> reindex(
        @PathVariable String source,
        @PathVariable String revisionId) {

        revisionOf(source, revisionId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(RevisionResponse.from(ingestionCoordinator.reindex(revisionId)));
    }

    private PolicyRevision revisionOf(String source, String revisionId) {
        PolicyRevision revision = registry.getRevision(revisionId);
        if (!revision.source().equals(source)) {
            throw EntityNotFoundException.revision(revisionId);
        }
        return revision;
    }
}
