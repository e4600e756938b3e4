package com.nevis.policy.service;

import com.nevis.policy.ingest.RevisionFileStore;
import com.nevis.policy.model.NewRevision;
import com.nevis.policy.model.RevisionCreation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class RevisionIntakeService {

    private final PolicyRegistry registry;
    private final RevisionFileStore fileStore;

    public RevisionCreation submit(String source, String versionLabel, LocalDate effectiveFrom,
                                   LocalDate effectiveTo, String notes, String filename, byte[] content) {
        PolicySlugs.requireValidSource(source);
        if (effectiveFrom == null) {
            throw new IllegalArgumentException("effective_from is required");
        }
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }

        String revisionKey = PolicySlugs.revisionId(source, effectiveFrom);
        String reference = fileStore.store(source, revisionKey, filename, content);
        try {
            return registry.createRevision(new NewRevision(source, versionLabel, effectiveFrom, effectiveTo,
                reference, (long) content.length, notes));
        } catch (RuntimeException e) {
            log.warn("Revision {} rejected ({}), removing stored file", revisionKey, e.getMessage());
            fileStore.delete(reference);
            throw e;
        }
    }
}
