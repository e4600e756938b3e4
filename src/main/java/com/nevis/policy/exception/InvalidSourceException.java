package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class InvalidSourceException extends RuntimeException {
    private final String source;

    public InvalidSourceException(String source) {
        super("Invalid policy source '%s': expected uppercase letters, digits and single underscores, e.g. LTN_1_20"
            .formatted(source));
        this.source = source;
    }
}
