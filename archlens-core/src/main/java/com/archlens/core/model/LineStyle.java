package com.archlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stroke style of a rendered edge.
 */
public enum LineStyle {
    SOLID,
    DASHED,
    DOTTED;

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
     *         the edge style turns into {@link #SOLID}
     */
    @JsonCreator
    public static LineStyle fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (LineStyle candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }
}
