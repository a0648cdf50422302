package com.archlens.core.generator;

import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.Cluster;
import com.archlens.core.model.Edge;
import com.archlens.core.model.FlowStep;
import com.archlens.core.model.FlowStepKind;
import com.archlens.core.model.LineStyle;
import com.archlens.core.model.Node;
import com.archlens.core.model.NodeKind;
import com.archlens.core.model.StepGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders architecture graphs and step graphs as Mermaid flowcharts.
 *
 * <p>Architecture graphs become one {@code subgraph} per cluster that holds nodes
 * (directly or through nested clusters), nested along the cluster tree. Node shapes
 * follow the node kind. Approved or solid edges render as {@code -->}, dashed
 * proposals as {@code -.->}.
 *
 * <p>Step graphs render decisions as diamonds with {@code |yes|}/{@code |no|} branch
 * labels and hidden join points as small circles.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MermaidGraphGenerator generator = new MermaidGraphGenerator();
 * Files.writeString(out.resolve("architecture.mmd"), generator.generateGraph(graph));
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid flowchart syntax</a>
 */
public class MermaidGraphGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGraphGenerator.class);

    private static final String FLOWCHART_HEADER = "flowchart TD\n";
    private static final String INDENT = "    ";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String SOLID_ARROW = " --> ";
    private static final String DASHED_ARROW = " -.-> ";

    /**
     * Renders an architecture graph.
     *
     * @param graph graph to render
     * @return Mermaid flowchart definition
     */
    public String generateGraph(ArchitectureGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        StringBuilder sb = new StringBuilder(FLOWCHART_HEADER);

        Map<String, Node> nodesById = new LinkedHashMap<>();
        graph.nodes().forEach(node -> nodesById.putIfAbsent(node.id(), node));

        Map<String, List<Cluster>> childClusters = new HashMap<>();
        List<Cluster> topLevel = new ArrayList<>();
        Set<String> clusterIds = new HashSet<>();
        graph.clusters().forEach(cluster -> clusterIds.add(cluster.id()));
        for (Cluster cluster : graph.clusters()) {
            if (cluster.parentId() != null && clusterIds.contains(cluster.parentId())) {
                childClusters.computeIfAbsent(cluster.parentId(), key -> new ArrayList<>()).add(cluster);
            } else {
                topLevel.add(cluster);
            }
        }

        Set<String> rendered = new HashSet<>();
        for (Cluster cluster : topLevel) {
            appendCluster(sb, cluster, childClusters, nodesById, rendered, INDENT);
        }
        for (Node node : nodesById.values()) {
            if (!rendered.contains(node.id())) {
                appendNode(sb, node, INDENT);
            }
        }

        int edgeCount = 0;
        for (Edge edge : graph.edges()) {
            if (edge.from() == null || edge.to() == null
                || !nodesById.containsKey(edge.from()) || !nodesById.containsKey(edge.to())) {
                continue;
            }
            String arrow = edge.approved() || edge.style().lineStyle() == LineStyle.SOLID ? SOLID_ARROW : DASHED_ARROW;
            sb.append(INDENT).append(sanitizeId(edge.from())).append(arrow).append(sanitizeId(edge.to())).append('\n');
            edgeCount++;
        }

        log.debug("Rendered Mermaid graph with {} nodes and {} edges", nodesById.size(), edgeCount);
        return sb.toString();
    }

    /**
     * Renders a step graph.
     *
     * @param stepGraph step graph to render
     * @return Mermaid flowchart definition
     */
    public String generateFlow(StepGraph stepGraph) {
        Objects.requireNonNull(stepGraph, "stepGraph must not be null");
        StringBuilder sb = new StringBuilder(FLOWCHART_HEADER);

        for (FlowStep step : stepGraph.steps()) {
            sb.append(INDENT).append(sanitizeId(step.id())).append(stepShape(step)).append('\n');
        }
        for (FlowStep step : stepGraph.steps()) {
            String from = sanitizeId(step.id());
            boolean decision = step.kind() == FlowStepKind.DECISION;
            if (step.next() != null) {
                sb.append(INDENT).append(from).append(decision ? " -->|yes| " : SOLID_ARROW)
                    .append(sanitizeId(step.next())).append('\n');
            }
            if (step.alternateNext() != null) {
                sb.append(INDENT).append(from).append(" -->|no| ")
                    .append(sanitizeId(step.alternateNext())).append('\n');
            }
        }

        log.debug("Rendered Mermaid flow '{}' with {} steps", stepGraph.id(), stepGraph.steps().size());
        return sb.toString();
    }

    private void appendCluster(StringBuilder sb, Cluster cluster, Map<String, List<Cluster>> childClusters,
                               Map<String, Node> nodesById, Set<String> rendered, String indent) {
        if (!holdsNodes(cluster, childClusters, nodesById)) {
            return;
        }
        sb.append(indent).append("subgraph ").append(sanitizeId(cluster.id()))
            .append(" [\"").append(escape(cluster.label())).append("\"]\n");
        String inner = indent + INDENT;
        for (String memberId : cluster.children()) {
            Node node = nodesById.get(memberId);
            if (node != null && rendered.add(memberId)) {
                appendNode(sb, node, inner);
            }
        }
        for (Cluster child : childClusters.getOrDefault(cluster.id(), List.of())) {
            appendCluster(sb, child, childClusters, nodesById, rendered, inner);
        }
        sb.append(indent).append("end\n");
    }

    private boolean holdsNodes(Cluster cluster, Map<String, List<Cluster>> childClusters, Map<String, Node> nodesById) {
        if (cluster.children().stream().anyMatch(nodesById::containsKey)) {
            return true;
        }
        return childClusters.getOrDefault(cluster.id(), List.of()).stream()
            .anyMatch(child -> holdsNodes(child, childClusters, nodesById));
    }

    private void appendNode(StringBuilder sb, Node node, String indent) {
        String label = escape(node.label());
        String shape = NodeKind.fromValue(node.kind()).map(kind -> switch (kind) {
            case DOCUMENTATION -> "[/\"" + label + "\"/]";
            case TEST -> "([\"" + label + "\"])";
            case CONFIG -> "{{\"" + label + "\"}}";
            case EXTERNAL -> "((\"" + label + "\"))";
            case CLUSTER -> "[[\"" + label + "\"]]";
            case HISTORY -> ">\"" + label + "\"]";
            default -> "[\"" + label + "\"]";
        }).orElse("[\"" + label + "\"]");
        sb.append(indent).append(sanitizeId(node.id())).append(shape).append('\n');
    }

    private String stepShape(FlowStep step) {
        if (step.hidden()) {
            return "((\" \"))";
        }
        String label = escape(step.label());
        return switch (step.kind()) {
            case START, END -> "([\"" + label + "\"])";
            case DECISION -> "{\"" + label + "\"}";
            case PROCESS -> switch (step.tag()) {
                case API_CALL -> "[/\"" + label + "\"/]";
                case DB_QUERY -> "[(\"" + label + "\")]";
                case LOG -> ">\"" + label + "\"]";
                default -> "[\"" + label + "\"]";
            };
        };
    }

    /**
     * Sanitizes an identifier for use as a Mermaid node id.
     *
     * @param id raw identifier
     * @return identifier with every non-word character replaced by an underscore
     */
    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "#quot;").replace("\n", " ");
    }
}
