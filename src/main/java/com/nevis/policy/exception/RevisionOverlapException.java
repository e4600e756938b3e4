package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class RevisionOverlapException extends RuntimeException {
    private final String source;
    private final String conflictingRevisionId;

    public RevisionOverlapException(String source, String conflictingRevisionId, String message) {
        super(message);
        this.source = source;
        this.conflictingRevisionId = conflictingRevisionId;
    }
}
