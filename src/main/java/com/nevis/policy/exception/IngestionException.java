package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public abstract class IngestionException extends RuntimeException {
    private final String errorCode;

    protected IngestionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String describe() {
        return errorCode + ": " + getMessage();
    }
}
