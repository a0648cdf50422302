package com.archlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A directory-derived grouping of nodes.
 *
 * <p>Clusters form a tree through {@code parentId}, mirroring directory nesting.
 *
 * @param id cluster identifier
 * @param label display label (directory path, "ROOT", or a dedicated shelf name)
 * @param parentId parent cluster id, null for top-level clusters
 * @param children ids of member nodes
 * @param bounds layout rectangle
 * @param collapsed whether the cluster is rendered collapsed
 */
public record Cluster(
    String id,
    String label,
    String parentId,
    List<String> children,
    Bounds bounds,
    boolean collapsed
) {
    /**
     * Compact constructor with validation.
     */
    public Cluster {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        children = children == null ? List.of() : List.copyOf(children);
        if (bounds == null) {
            bounds = new Bounds(0, 0, 0, 0);
        }
    }
}
