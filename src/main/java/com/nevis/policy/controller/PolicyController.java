package com.nevis.policy.controller;

import com.nevis.policy.model.DocumentUpdate;
import com.nevis.policy.model.PolicyCategory;
import com.nevis.policy.model.PolicyDocument;
import com.nevis.policy.service.EffectiveDateResolver;
import com.nevis.policy.service.PolicyRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/policies")
@RequiredArgsConstructor
public class PolicyController {

    private final PolicyRegistry registry;
    private final EffectiveDateResolver resolver;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<PolicyResponse> createPolicy(@Valid @RequestBody CreatePolicyRequest request) {
        PolicyDocument document = registry.createDocument(
            request.source(),
            request.title(),
            request.description(),
            request.category()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(PolicyResponse.from(document));
    }

    @GetMapping
    public ResponseEntity<List<PolicyResponse>> listPolicies(
        @RequestParam(name = "category", required = false) PolicyCategory category,
        @RequestParam(name = "source_prefix", required = false) String sourcePrefix) {

        List<PolicyResponse> policies = registry.listDocuments(category, sourcePrefix, LocalDate.now(clock)).stream()
            .map(PolicyResponse::from)
            .toList();
        return ResponseEntity.ok(policies);
    }

    @GetMapping("/effective")
    public ResponseEntity<EffectiveSnapshotResponse> effectiveSnapshot(
        @RequestParam(name = "date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(EffectiveSnapshotResponse.from(resolver.resolveSnapshot(date)));
    }

    @GetMapping("/{source}")
    public ResponseEntity<PolicyResponse> getPolicy(@PathVariable String source) {
        return ResponseEntity.ok(PolicyResponse.from(registry.getDocument(source, LocalDate.now(clock))));
    }

    @PatchMapping("/{source}")
    public ResponseEntity<PolicyResponse> updatePolicy(
        @PathVariable String source,
        @Valid @RequestBody UpdatePolicyRequest request) {

        PolicyDocument updated = registry.updateDocument(source,
            new DocumentUpdate(request.title(), request.description(), request.category()));
        return ResponseEntity.ok(PolicyResponse.from(updated));
    }

    @GetMapping("/{source}/effective")
    public ResponseEntity<EffectiveRevisionResponse> effectiveRevision(
        @PathVariable String source,
        @RequestParam(name = "date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(EffectiveRevisionResponse.from(resolver.resolve(source, date)));
    }
}
