package com.archlens.core.model;

import java.util.Objects;

/**
 * A raw, unresolved reference token found in a file.
 *
 * @param sourceFile path of the referencing file
 * @param target module name, relative path or identifier as written (quotes stripped)
 * @param kind syntactic origin, may be null
 * @param local true when the token was written as a same-project reference
 *              (quoted include, relative import)
 */
public record Reference(
    String sourceFile,
    String target,
    ReferenceKind kind,
    boolean local
) {
    /**
     * Compact constructor with validation.
     */
    public Reference {
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}
