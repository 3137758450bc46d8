package com.openforge.kairn.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.kairn.error.KairnException;

import java.util.Locale;

/**
 * Progressive disclosure level for node payloads.
 *
 * SUMMARY — id, name, type only; the default for initial context loads
 * FULL    — complete record with tags, properties and connected edges
 */
public enum Detail {
    SUMMARY,
    FULL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Detail parseOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return SUMMARY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw KairnException.invalidArgument("Invalid detail: " + value + ". Must be summary or full");
        }
    }
}
