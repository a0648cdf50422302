package com.archlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of structural issues reported by the health analyzer.
 */
public enum IssueKind {
    CIRCULAR("circular"),
    DEAD_END("dead-end"),
    BOTTLENECK("bottleneck"),
    ISOLATED("isolated"),
    SCHEMA_VIOLATION("schema-violation"),
    WARNING("warning");

    private final String value;

    IssueKind(String value) {
        this.value = value;
    }

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
    public static IssueKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (IssueKind candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }
}
