package com.archlens.core.analyzer.check;

import com.archlens.core.analyzer.GraphIndex;
import com.archlens.core.analyzer.HealthCheck;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.Edge;
import com.archlens.core.model.IssueKind;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;
import com.archlens.core.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates node kinds and edge endpoints.
 *
 * <ul>
 *   <li>Node with an unrecognized kind: high</li>
 *   <li>Edge with a missing from/to: critical</li>
 *   <li>Edge naming a node id absent from the graph: critical</li>
 * </ul>
 */
public class SchemaViolationCheck implements HealthCheck {

    @Override
    public String getId() {
        return IssueKind.SCHEMA_VIOLATION.value();
    }

    @Override
    public List<AnalysisIssue> check(GraphIndex index) {
        List<AnalysisIssue> issues = new ArrayList<>();

        for (Node node : index.graph().nodes()) {
            if (!NodeKind.isRecognized(node.kind())) {
                issues.add(AnalysisIssue.of(
                    IssueKind.SCHEMA_VIOLATION,
                    IssueSeverity.HIGH,
                    "Schema violation: node '" + node.label() + "' has unknown kind '" + node.kind() + "'",
                    List.of(node.id())
                ));
            }
        }

        for (Edge edge : index.graph().edges()) {
            if (isBlank(edge.from()) || isBlank(edge.to())) {
                issues.add(AnalysisIssue.of(
                    IssueKind.SCHEMA_VIOLATION,
                    IssueSeverity.CRITICAL,
                    "Schema violation: edge '" + edge.id() + "' is missing its from/to endpoint",
                    List.of()
                ));
                continue;
            }
            List<String> known = new ArrayList<>();
            List<String> dangling = new ArrayList<>();
            for (String endpoint : List.of(edge.from(), edge.to())) {
                if (index.containsNode(endpoint)) {
                    known.add(endpoint);
                } else {
                    dangling.add(endpoint);
                }
            }
            if (!dangling.isEmpty()) {
                issues.add(AnalysisIssue.of(
                    IssueKind.SCHEMA_VIOLATION,
                    IssueSeverity.CRITICAL,
                    "Schema violation: edge '" + edge.id() + "' references unknown node " + String.join(", ", dangling),
                    known
                ));
            }
        }
        return issues;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
