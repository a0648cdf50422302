package com.archlens.core.analyzer;

import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.Edge;
import com.archlens.core.model.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only degree and adjacency view of an {@link ArchitectureGraph}, built once per
 * analysis and shared by all checks.
 *
 * <p>Degrees count every edge naming a node, including edges whose other endpoint is
 * unknown. Adjacency only holds edges between existing nodes, in edge order.
 */
public final class GraphIndex {

    private final ArchitectureGraph graph;
    private final Map<String, Node> nodesById = new LinkedHashMap<>();
    private final Map<String, Integer> incoming = new HashMap<>();
    private final Map<String, Integer> outgoing = new HashMap<>();
    private final Map<String, List<String>> successors = new HashMap<>();

    private GraphIndex(ArchitectureGraph graph) {
        this.graph = graph;
        for (Node node : graph.nodes()) {
            nodesById.putIfAbsent(node.id(), node);
            successors.putIfAbsent(node.id(), new ArrayList<>());
        }
        for (Edge edge : graph.edges()) {
            if (edge.from() != null) {
                outgoing.merge(edge.from(), 1, Integer::sum);
            }
            if (edge.to() != null) {
                incoming.merge(edge.to(), 1, Integer::sum);
            }
            if (edge.from() != null && edge.to() != null && nodesById.containsKey(edge.to())) {
                List<String> targets = successors.get(edge.from());
                if (targets != null) {
                    targets.add(edge.to());
                }
            }
        }
    }

    public static GraphIndex of(ArchitectureGraph graph) {
        return new GraphIndex(Objects.requireNonNull(graph, "graph must not be null"));
    }

    public ArchitectureGraph graph() {
        return graph;
    }

    public boolean containsNode(String id) {
        return id != null && nodesById.containsKey(id);
    }

    public int incomingCount(String id) {
        return incoming.getOrDefault(id, 0);
    }

    public int outgoingCount(String id) {
        return outgoing.getOrDefault(id, 0);
    }

    /**
     * Returns the targets of a node's outgoing edges.
     *
     * @param id node id
     * @return successor ids, empty for unknown nodes
     */
    public List<String> successors(String id) {
        return successors.getOrDefault(id, List.of());
    }

    /**
     * Returns the display label of a node, falling back to its id.
     *
     * @param id node id
     * @return label
     */
    public String labelOf(String id) {
        Node node = nodesById.get(id);
        return node != null ? node.label() : id;
    }
}
