package com.archlens.core.analyzer;

import com.archlens.core.config.ProjectConfig;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.Edge;
import com.archlens.core.model.IssueKind;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.archlens.core.analyzer.GraphFixtures.edge;
import static com.archlens.core.analyzer.GraphFixtures.node;
import static com.archlens.core.analyzer.GraphFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GraphHealthAnalyzer}.
 */
class GraphHealthAnalyzerTest {

    private final GraphHealthAnalyzer analyzer = new GraphHealthAnalyzer();

    @Test
    void getChecks_byDefault_runsInFixedOrder() {
        assertThat(analyzer.getChecks())
            .extracting(HealthCheck::getId)
            .containsExactly("isolated", "circular", "dead-end", "bottleneck", "schema-violation");
    }

    @Test
    void analyze_withEmptyGraph_reportsNothing() {
        assertThat(analyzer.analyze(ArchitectureGraph.empty())).isEmpty();
    }

    @Test
    void analyze_withThreeNodeCycle_reportsExactlyOneCircularIssue() {
        // Given: A -> B -> C -> A
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(source("A", 1), source("B", 1), source("C", 1)),
            List.of(edge("A", "B"), edge("B", "C"), edge("C", "A")),
            List.of()
        );

        // When: Analyzing
        List<AnalysisIssue> issues = analyzer.analyze(graph);

        // Then: One critical cycle naming all three nodes, nothing else
        assertThat(issues).hasSize(1);
        AnalysisIssue cycle = issues.get(0);
        assertThat(cycle.kind()).isEqualTo(IssueKind.CIRCULAR);
        assertThat(cycle.severity()).isEqualTo(IssueSeverity.CRITICAL);
        assertThat(cycle.nodeIds()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(cycle.message()).isEqualTo("Circular dependency: A -> B -> C -> A");
    }

    @Test
    void analyze_withTerminalNodeInReasoningLayer_reportsDeadEnd() {
        // Given: A (layer 0) -> B (layer 1)
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(source("A", 0), source("B", 1)),
            List.of(edge("A", "B")),
            List.of()
        );

        // When: Analyzing
        List<AnalysisIssue> issues = analyzer.analyze(graph);

        // Then: B is a high-severity dead end
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.DEAD_END);
            assertThat(issue.severity()).isEqualTo(IssueSeverity.HIGH);
            assertThat(issue.nodeIds()).containsExactly("B");
            assertThat(issue.message()).isEqualTo("Dead-end: no flow continues from 'B'");
        });
    }

    @Test
    void analyze_withTerminalNodeInDiscoveryLayer_reportsNoDeadEnd() {
        // Given: A -> B, both in layer 0
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(source("A", 0), source("B", 0)),
            List.of(edge("A", "B")),
            List.of()
        );

        // When/Then: Nothing is reported
        assertThat(analyzer.analyze(graph)).isEmpty();
    }

    @Test
    void analyze_withExternalOrDocumentationTarget_reportsNoDeadEnd() {
        // Given: Edges into an external module and a document
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(source("A", 0), node("ext", "external", 2), node("doc", "documentation", 1)),
            List.of(edge("A", "ext"), edge("A", "doc")),
            List.of()
        );

        // When/Then: Terminal externals and documents are expected
        assertThat(analyzer.analyze(graph)).isEmpty();
    }

    @Test
    void analyze_withFiveIncomingEdges_reportsBottleneck() {
        // When: Analyzing hubs with five and four incoming edges
        List<AnalysisIssue> five = bottlenecks(analyzer.analyze(hub(5)));
        List<AnalysisIssue> four = bottlenecks(analyzer.analyze(hub(4)));

        // Then: Only five reaches the default threshold
        assertThat(five).singleElement().satisfies(issue -> {
            assertThat(issue.severity()).isEqualTo(IssueSeverity.MEDIUM);
            assertThat(issue.nodeIds()).containsExactly("hub");
            assertThat(issue.message()).isEqualTo("Possible bottleneck: 'hub' has 5 incoming dependencies");
        });
        assertThat(four).isEmpty();
    }

    @Test
    void analyze_withLoweredThreshold_reportsSmallerHubs() {
        // Given: An analyzer flagging three incoming edges
        GraphHealthAnalyzer strict = new GraphHealthAnalyzer(new AnalyzerSettings(3, 1));

        // When/Then: A four-edge hub is now a bottleneck
        assertThat(bottlenecks(strict.analyze(hub(4)))).hasSize(1);
    }

    @Test
    void analyze_withUnknownNodeKind_reportsHighSchemaViolation() {
        // Given: A node with a kind outside the recognized set
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(node("A", "wizard", 0), source("B", 0)),
            List.of(edge("A", "B")),
            List.of()
        );

        // When: Analyzing
        List<AnalysisIssue> issues = analyzer.analyze(graph);

        // Then: The unknown kind is flagged
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.SCHEMA_VIOLATION);
            assertThat(issue.severity()).isEqualTo(IssueSeverity.HIGH);
            assertThat(issue.message()).isEqualTo("Schema violation: node 'A' has unknown kind 'wizard'");
        });
    }

    @Test
    void analyze_withRecognizedKindInOtherCase_reportsNoSchemaViolation() {
        // Given: Kinds written in upper case
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(node("A", "SOURCE", 0), node("B", "Config", 0)),
            List.of(edge("A", "B")),
            List.of()
        );

        // When/Then: Kinds compare case-insensitively
        assertThat(analyzer.analyze(graph)).isEmpty();
    }

    @Test
    void analyze_withBrokenEdges_reportsCriticalSchemaViolations() {
        // Given: An edge missing its target and an edge to an unknown node
        Edge missing = new Edge("edge_missing", "A", null, null, false, null);
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(source("A", 0)),
            List.of(missing, edge("A", "ghost")),
            List.of()
        );

        // When: Analyzing
        List<AnalysisIssue> schema = analyzer.analyze(graph).stream()
            .filter(issue -> issue.kind() == IssueKind.SCHEMA_VIOLATION)
            .toList();

        // Then: Both edges are critical, the dangling one names its known endpoint
        assertThat(schema).hasSize(2);
        assertThat(schema).allMatch(issue -> issue.severity() == IssueSeverity.CRITICAL);
        assertThat(schema.get(0).message()).isEqualTo("Schema violation: edge 'edge_missing' is missing its from/to endpoint");
        assertThat(schema.get(0).nodeIds()).isEmpty();
        assertThat(schema.get(1).message()).contains("edge_A_ghost").contains("ghost");
        assertThat(schema.get(1).nodeIds()).containsExactly("A");
    }

    @Test
    void analyze_withUnconnectedNodes_reportsIsolatedSourcesOnly() {
        // Given: Unconnected source, documentation and cluster nodes
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(source("lonely", 1), node("doc", "documentation", 0), node("group", "cluster", 0)),
            List.of(),
            List.of()
        );

        // When: Analyzing
        List<AnalysisIssue> issues = analyzer.analyze(graph);

        // Then: Only the source node is isolated
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.ISOLATED);
            assertThat(issue.severity()).isEqualTo(IssueSeverity.MEDIUM);
            assertThat(issue.nodeIds()).containsExactly("lonely");
            assertThat(issue.message()).isEqualTo("Isolated node: 'lonely' is not connected to any flow");
        });
    }

    @Test
    void settings_fromConfig_usesConfiguredValues() {
        // Given: Defaults from an empty config
        AnalyzerSettings settings = AnalyzerSettings.from(ProjectConfig.defaults());

        // Then: Default thresholds apply
        assertThat(settings).isEqualTo(AnalyzerSettings.defaults());
        assertThat(settings.bottleneckThreshold()).isEqualTo(5);
        assertThat(settings.deadEndMinLayer()).isEqualTo(1);
    }

    @Test
    void settings_withNonPositiveThreshold_throws() {
        assertThatThrownBy(() -> new AnalyzerSettings(0, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ArchitectureGraph hub(int fanIn) {
        List<Node> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        nodes.add(source("hub", 0));
        for (int i = 0; i < fanIn; i++) {
            nodes.add(source("caller" + i, 0));
            edges.add(edge("caller" + i, "hub"));
        }
        return new ArchitectureGraph(nodes, edges, List.of());
    }

    private static List<AnalysisIssue> bottlenecks(List<AnalysisIssue> issues) {
        return issues.stream().filter(issue -> issue.kind() == IssueKind.BOTTLENECK).toList();
    }
}
