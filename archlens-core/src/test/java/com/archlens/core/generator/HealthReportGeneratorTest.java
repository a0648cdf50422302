package com.archlens.core.generator;

import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.IssueKind;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;
import com.archlens.core.model.NodeDisplay;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link HealthReportGenerator}.
 */
class HealthReportGeneratorTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneId.of("UTC"));

    private final HealthReportGenerator generator = new HealthReportGenerator(FIXED_CLOCK);

    @Test
    void generateReport_withNoIssues_printsCleanBill() {
        // When: Reporting an empty issue list
        String report = generator.generateReport(List.of(), ArchitectureGraph.empty());

        // Then: Title, timestamp, clean bill and footer
        assertThat(report).startsWith("# ArchLens Architecture Health Report\n\n");
        assertThat(report).contains("Generated: 2026-03-01 10:15:30 UTC\n\n");
        assertThat(report).contains("✅ No architecture defects found. The structure is clean.");
        assertThat(report).doesNotContain("Major Risks");
        assertThat(report).endsWith("*Generated by the ArchLens graph health analyzer.*\n");
    }

    @Test
    void generateReport_withMixedIssues_groupsBySeverity() {
        // Given: One issue per severity class, high listed before critical
        ArchitectureGraph graph = new ArchitectureGraph(
            List.of(node("node_a", "engine.ts"), node("node_b", "db.ts")),
            List.of(),
            List.of()
        );
        List<AnalysisIssue> issues = List.of(
            AnalysisIssue.of(IssueKind.DEAD_END, IssueSeverity.HIGH, "Dead-end: no flow continues from 'db.ts'", List.of("node_b")),
            AnalysisIssue.of(IssueKind.CIRCULAR, IssueSeverity.CRITICAL, "Circular dependency: x", List.of("node_a", "node_b")),
            AnalysisIssue.of(IssueKind.SCHEMA_VIOLATION, IssueSeverity.CRITICAL, "Schema violation: edge 'e1'", List.of()),
            AnalysisIssue.of(IssueKind.BOTTLENECK, IssueSeverity.MEDIUM, "Possible bottleneck: 'db.ts'", List.of("node_b"))
        );

        // When: Reporting
        String report = generator.generateReport(issues, graph);

        // Then: Critical issues come first, then high, then the notes section
        assertThat(report).contains("## 🚨 Major Risks (3)\n\n");
        assertThat(report).contains("### 🔴 Circular dependency: x\n"
            + "- Related nodes: [`engine.ts`](command:archlens.focusNode?%22node_a%22), "
            + "[`db.ts`](command:archlens.focusNode?%22node_b%22)\n\n");
        assertThat(report).contains("### 🔴 Schema violation: edge 'e1'\n- Related nodes: none\n\n");
        assertThat(report).contains("### 🟠 Dead-end: no flow continues from 'db.ts'\n");
        assertThat(report.indexOf("🔴 Schema")).isLessThan(report.indexOf("🟠"));
        assertThat(report).contains("## ⚠️ Notes and Bottlenecks (1)\n\n- [BOTTLENECK] Possible bottleneck: 'db.ts'\n");
    }

    @Test
    void generateReport_withOnlyMajorIssues_omitsNotesSection() {
        // When: Reporting a single high issue for an unknown node
        String report = generator.generateReport(List.of(
            AnalysisIssue.of(IssueKind.DEAD_END, IssueSeverity.HIGH, "Dead-end", List.of("ghost"))
        ), ArchitectureGraph.empty());

        // Then: The id is used as label and there is no notes section
        assertThat(report).contains("[`ghost`](command:archlens.focusNode?%22ghost%22)");
        assertThat(report).doesNotContain("Notes and Bottlenecks");
    }

    @Test
    void focusLink_withSpecialCharacters_encodesAsUriComponent() {
        assertThat(generator.focusLink("node a/b")).isEqualTo("command:archlens.focusNode?%22node%20a%2Fb%22");
        assertThat(generator.focusLink("it's(1)~")).isEqualTo("command:archlens.focusNode?%22it's(1)~%22");
    }

    private static Node node(String id, String label) {
        return new Node(id, "source", null, null, 1, 50, label, new NodeDisplay(label, null, null, null, 0.5, null));
    }
}
