package com.archlens.core.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed node/edge/cluster graph produced by one assembly pass.
 *
 * @param nodes graph nodes, ids unique
 * @param edges directed edges
 * @param clusters cluster tree
 */
public record ArchitectureGraph(
    List<Node> nodes,
    List<Edge> edges,
    List<Cluster> clusters
) {
    /**
     * Compact constructor with immutable copies.
     */
    public ArchitectureGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }

    public static ArchitectureGraph empty() {
        return new ArchitectureGraph(List.of(), List.of(), List.of());
    }

    /**
     * Finds a node by id.
     *
     * @param id node id
     * @return node, empty when absent
     */
    public Optional<Node> findNode(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    /**
     * Finds the node created for a file path.
     *
     * @param file project-relative path
     * @return node, empty when no node carries that path
     */
    public Optional<Node> findNodeByFile(String file) {
        return nodes.stream().filter(node -> file.equals(node.file())).findFirst();
    }

    public Optional<Cluster> findCluster(String id) {
        return clusters.stream().filter(cluster -> cluster.id().equals(id)).findFirst();
    }

    public Set<String> nodeIds() {
        return nodes.stream().map(Node::id).collect(Collectors.toUnmodifiableSet());
    }
}
