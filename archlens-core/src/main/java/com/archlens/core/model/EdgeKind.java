package com.archlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of directed relationships between nodes.
 */
public enum EdgeKind {
    DEPENDENCY,
    DATA_FLOW,
    EVENT,
    CONDITIONAL,
    ORIGIN;

    private final String value = name().toLowerCase(Locale.ROOT);

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a serialized value, accepting the value or the constant name in any case.
     *
     * @param value serialized value
     * @return matching constant, null when the value is not recognized, which
     *         the edge record turns into {@link #DEPENDENCY}
     */
    @JsonCreator
    public static EdgeKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (EdgeKind candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }
}
