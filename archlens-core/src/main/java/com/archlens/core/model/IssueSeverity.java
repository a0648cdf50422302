package com.archlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an analysis issue, most severe first.
 */
public enum IssueSeverity {
    /** Breaks the architecture (cycles, broken edges). */
    CRITICAL,

    /** Likely defect that should be fixed. */
    HIGH,

    /** Smell worth reviewing. */
    MEDIUM,

    /** Informational. */
    LOW;

    private final String value = name().toLowerCase(Locale.ROOT);

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a serialized value, accepting the value or the constant name in any case.
     *
     * @param value serialized value
     * @return matching constant, null when the value is not recognized
     */
    @JsonCreator
    public static IssueSeverity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (IssueSeverity candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }
}
