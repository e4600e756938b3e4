package com.nevis.policy.exception;

import lombok.Getter;

@Getter
public class SectionNotFoundException extends RuntimeException {
    private final String source;
    private final String sectionRef;

    public SectionNotFoundException(String source, String sectionRef, String message) {
        super(message);
        this.source = source;
        this.sectionRef = sectionRef;
    }
}
