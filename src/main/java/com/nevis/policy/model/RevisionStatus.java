package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum RevisionStatus {
    PROCESSING,
    ACTIVE,
    FAILED,
    SUPERSEDED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isIndexed() {
        return this == ACTIVE || this == SUPERSEDED;
    }

    @JsonCreator
    public static RevisionStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown revision status: " + value));
    }
}
