package com.archlens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a node.
 */
public enum NodeStatus {
    /** Discovered but not yet approved by a user. */
    PROPOSED,

    /** Approved and part of the working architecture. */
    ACTIVE,

    /** Locked against edits (e.g. history snapshots). */
    READ_ONLY;

    private final String value = name().toLowerCase(Locale.ROOT);

    /**
     * Returns the serialized form.
     *
     * @return status value such as "read_only"
     */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a serialized value, accepting the value or the constant name in any case.
     *
     * @param value serialized value
     * @return matching constant, null when the value is not recognized, which
     *         the node record turns into {@link #PROPOSED}
     */
    @JsonCreator
    public static NodeStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (NodeStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        return null;
    }
}
