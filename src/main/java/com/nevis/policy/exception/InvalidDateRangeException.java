package com.nevis.policy.exception;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class InvalidDateRangeException extends RuntimeException {
    private final LocalDate effectiveFrom;
    private final LocalDate effectiveTo;

    public InvalidDateRangeException(LocalDate effectiveFrom, LocalDate effectiveTo) {
        super("effective_to (%s) must not be before effective_from (%s)".formatted(effectiveTo, effectiveFrom));
        this.effectiveFrom = effectiveFrom;
        this.effectiveTo = effectiveTo;
    }
}
