package com.archlens.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognized node kinds.
 *
 * <p>{@link Node#kind()} is carried as a raw string so that graphs produced by
 * other collaborators can hold unknown kinds; the health analyzer reports those
 * as schema violations.
 */
public enum NodeKind {
    SOURCE,
    DOCUMENTATION,
    TEST,
    CONFIG,
    EXTERNAL,
    CLUSTER,
    HISTORY;

    /**
     * Returns the serialized form (lowercase name).
     *
     * @return kind value such as "source"
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a raw kind string.
     *
     * @param value raw kind, case-insensitive
     * @return matching kind, empty when the value is not recognized
     */
    public static Optional<NodeKind> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(kind -> kind.value().equalsIgnoreCase(value))
            .findFirst();
    }

    public static boolean isRecognized(String value) {
        return fromValue(value).isPresent();
    }
}
