package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class CannotDeleteSoleRevisionException extends RuntimeException {
    private final String source;
    private final String revisionId;

    public CannotDeleteSoleRevisionException(String source, String revisionId) {
        super("Cannot delete %s: it is the only revision of %s".formatted(revisionId, source));
        this.source = source;
        this.revisionId = revisionId;
    }
}
