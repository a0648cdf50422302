package com.archlens.core.model;

import java.util.Objects;

/**
 * A graph node representing a file, a directory cluster or a synthetic entity.
 *
 * @param id stable identifier derived from the path
 * @param kind raw node kind, normally one of {@link NodeKind#value()}
 * @param status lifecycle status
 * @param position layout position
 * @param layer semantic layer (0 discovery, 1 reasoning, 2+ action)
 * @param priority execution priority hint, lower runs first
 * @param file project-relative file path, null for synthetic nodes without one
 * @param display display metadata
 */
public record Node(
    String id,
    String kind,
    NodeStatus status,
    Position position,
    int layer,
    int priority,
    String file,
    NodeDisplay display
) {
    /**
     * Compact constructor with validation.
     */
    public Node {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(display, "display must not be null");
        if (status == null) {
            status = NodeStatus.PROPOSED;
        }
        if (position == null) {
            position = Position.origin();
        }
    }

    public String label() {
        return display.label();
    }

    /**
     * Checks whether this node has the given recognized kind.
     *
     * @param nodeKind kind to compare against
     * @return true when the raw kind equals the kind's value
     */
    public boolean hasKind(NodeKind nodeKind) {
        return nodeKind.value().equalsIgnoreCase(kind);
    }
}
