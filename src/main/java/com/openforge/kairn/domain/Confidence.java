package com.openforge.kairn.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.kairn.error.KairnException;

import java.util.Locale;

/**
 * Caller-asserted confidence tier. Drives two things:
 *   - routing: HIGH facts become permanent nodes, MEDIUM/LOW only decaying experiences
 *   - decay:   the multiplier applied to the type's base decay rate
 */
public enum Confidence {
    HIGH(1.0),
    MEDIUM(2.0),
    LOW(4.0);

    private final double decayMultiplier;

    Confidence(double decayMultiplier) {
        this.decayMultiplier = decayMultiplier;
    }

    public double decayMultiplier() {
        return decayMultiplier;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Null or blank means the default, HIGH. */
    public static Confidence parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return HIGH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw KairnException.invalidArgument(
                    "Invalid confidence: " + value + ". Must be one of [high, medium, low]");
        }
    }
}
