package com.archlens.core.model;

import java.util.Objects;

/**
 * A resolved file-level dependency.
 *
 * @param from path of the depending file
 * @param to path of the target file, or {@code external:<token>} for external modules
 * @param kind relationship kind
 * @param label optional label
 */
public record Dependency(
    String from,
    String to,
    EdgeKind kind,
    String label
) {
    /** Path prefix used for synthetic external-module targets. */
    public static final String EXTERNAL_PREFIX = "external:";

    /**
     * Compact constructor with validation.
     */
    public Dependency {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (kind == null) {
            kind = EdgeKind.DEPENDENCY;
        }
    }

    public static Dependency of(String from, String to) {
        return new Dependency(from, to, EdgeKind.DEPENDENCY, null);
    }

    public boolean targetsExternal() {
        return to.startsWith(EXTERNAL_PREFIX);
    }
}
