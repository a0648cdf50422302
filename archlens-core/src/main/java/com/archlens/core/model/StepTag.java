package com.archlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic tag of a process step, derived from the called name.
 */
public enum StepTag {
    NONE,
    API_CALL,
    DB_QUERY,
    LOG;

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
     *         the step record turns into {@link #NONE}
     */
    @JsonCreator
    public static StepTag fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StepTag candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }
}
