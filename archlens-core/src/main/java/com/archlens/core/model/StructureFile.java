package com.archlens.core.model;

import java.util.Objects;

/**
 * A file entry of a {@link ProjectStructure}.
 *
 * @param path project-relative path
 * @param kind node kind the file becomes
 * @param description short description
 */
public record StructureFile(
    String path,
    NodeKind kind,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public StructureFile {
        Objects.requireNonNull(path, "path must not be null");
        path = path.replace('\\', '/');
        if (kind == null) {
            kind = NodeKind.SOURCE;
        }
        if (description == null) {
            description = "";
        }
    }
}
