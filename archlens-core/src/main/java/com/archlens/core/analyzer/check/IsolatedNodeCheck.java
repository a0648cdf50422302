package com.archlens.core.analyzer.check;

import com.archlens.core.analyzer.GraphIndex;
import com.archlens.core.analyzer.HealthCheck;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.IssueKind;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;
import com.archlens.core.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports nodes without any incident edge. Clusters and documentation are exempt.
 */
public class IsolatedNodeCheck implements HealthCheck {

    @Override
    public String getId() {
        return IssueKind.ISOLATED.value();
    }

    @Override
    public List<AnalysisIssue> check(GraphIndex index) {
        List<AnalysisIssue> issues = new ArrayList<>();
        for (Node node : index.graph().nodes()) {
            if (node.hasKind(NodeKind.CLUSTER) || node.hasKind(NodeKind.DOCUMENTATION)) {
                continue;
            }
            if (index.incomingCount(node.id()) == 0 && index.outgoingCount(node.id()) == 0) {
                issues.add(AnalysisIssue.of(
                    IssueKind.ISOLATED,
                    IssueSeverity.MEDIUM,
                    "Isolated node: '" + node.label() + "' is not connected to any flow",
                    List.of(node.id())
                ));
            }
        }
        return issues;
    }
}
