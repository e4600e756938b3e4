package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class DocumentAlreadyExistsException extends RuntimeException {
    private final String source;

    public DocumentAlreadyExistsException(String source) {
        super("Policy already exists: " + source);
        this.source = source;
    }
}
