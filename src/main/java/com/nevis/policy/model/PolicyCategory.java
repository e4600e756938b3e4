package com.nevis.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum PolicyCategory {
    NATIONAL_POLICY,
    NATIONAL_GUIDANCE,
    LOCAL_PLAN,
    LOCAL_GUIDANCE,
    COUNTY_STRATEGY,
    SUPPLEMENTARY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyCategory fromValue(String value) {
        return Arrays.stream(values())
            .filter(category -> category.value().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown policy category: " + value));
    }
}
