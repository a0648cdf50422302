package com.archlens.core.model;

/**
 * A directed relationship between two nodes.
 *
 * <p>Endpoints are not validated here: an edge with a missing or unknown endpoint
 * is reported by the health analyzer rather than rejected.
 *
 * @param id edge identifier
 * @param from source node id
 * @param to target node id
 * @param kind relationship kind
 * @param approved whether a user approved the relationship
 * @param style display style
 */
public record Edge(
    String id,
    String from,
    String to,
    EdgeKind kind,
    boolean approved,
    EdgeStyle style
) {
    /**
     * Compact constructor with defaults.
     */
    public Edge {
        if (kind == null) {
            kind = EdgeKind.DEPENDENCY;
        }
        if (style == null) {
            style = new EdgeStyle(1, LineStyle.SOLID, null, false);
        }
    }
}
