package com.archlens.core.model;

import java.util.Objects;

/**
 * Display metadata attached to a node.
 *
 * @param label display name
 * @param description optional description
 * @param color fill color for the node kind
 * @param clusterId id of the owning cluster, may be null
 * @param opacity render opacity (0.5 for proposed nodes)
 * @param dashArray border dash pattern, may be null for solid borders
 */
public record NodeDisplay(
    String label,
    String description,
    String color,
    String clusterId,
    double opacity,
    String dashArray
) {
    /**
     * Compact constructor with validation.
     */
    public NodeDisplay {
        Objects.requireNonNull(label, "label must not be null");
        if (description == null) {
            description = "";
        }
    }
}
