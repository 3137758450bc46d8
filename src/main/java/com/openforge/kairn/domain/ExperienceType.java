package com.openforge.kairn.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.kairn.error.KairnException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Classifies an experience and fixes its base half-life (days, at HIGH confidence).
 *
 * SOLUTION    — a fix that worked                         (200 days)
 * PATTERN     — a reusable approach; fades slowest        (300 days)
 * DECISION    — a choice made and its reasoning           (100 days)
 * WORKAROUND  — a stop-gap; fades fastest                 ( 50 days)
 * GOTCHA      — a trap worth remembering                  (200 days)
 */
public enum ExperienceType {
    SOLUTION(200),
    PATTERN(300),
    DECISION(100),
    WORKAROUND(50),
    GOTCHA(200);

    private final double baseHalfLifeDays;

    ExperienceType(double baseHalfLifeDays) {
        this.baseHalfLifeDays = baseHalfLifeDays;
    }

    public double baseHalfLifeDays() {
        return baseHalfLifeDays;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExperienceType parse(String value) {
        if (value == null || value.isBlank()) {
            throw KairnException.invalidArgument("type is required, one of " + codes());
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw KairnException.invalidArgument("Invalid experience type: " + value + ". Must be one of " + codes());
        }
    }

    private static String codes() {
        return Arrays.stream(values()).map(ExperienceType::code).collect(Collectors.joining(", ", "[", "]"));
    }
}
