package com.arcdispatch.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reasoning effort and verbosity levels. Providers without reasoning support ignore them.
 */
public enum ReasoningLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReasoningLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low":
            case "minimal":
                return LOW;
            case "medium":
                return MEDIUM;
            case "high":
                return HIGH;
            default:
                throw new IllegalArgumentException("Unknown reasoning level: " + value);
        }
    }
}
