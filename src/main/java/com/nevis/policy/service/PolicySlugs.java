package com.nevis.policy.service;

import com.nevis.policy.exception.InvalidSourceException;

import java.time.LocalDate;
import java.util.regex.Pattern;

public final class PolicySlugs {

    private static final Pattern SOURCE_PATTERN = Pattern.compile("^[A-Z][A-Z0-9]*(_[A-Z0-9]+)*$");

    private PolicySlugs() {
    }

    public static String requireValidSource(String source) {
        if (source == null || source.length() > 100 || !SOURCE_PATTERN.matcher(source).matches()) {
            throw new InvalidSourceException(source);
        }
        return source;
    }

    /**
     * Base revision id for a start date. The registry appends {@code _2}, {@code _3}, ... when the
     * base id still belongs to a revision whose start date was later moved.
     */
    public static String revisionId(String source, LocalDate effectiveFrom) {
        return "rev_%s_%04d_%02d_%02d".formatted(
            source, effectiveFrom.getYear(), effectiveFrom.getMonthValue(), effectiveFrom.getDayOfMonth());
    }
}
