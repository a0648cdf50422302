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
 * Reports nodes that are reached but lead nowhere: at least one incoming edge, no
 * outgoing edge.
 *
 * <p>Only nodes at or above the minimum layer are checked, since discovery-layer
 * sources and configs are expected to be leaves. Clusters, external modules and
 * documentation are exempt.
 */
public class DeadEndCheck implements HealthCheck {

    private final int minLayer;

    public DeadEndCheck(int minLayer) {
        this.minLayer = minLayer;
    }

    @Override
    public String getId() {
        return IssueKind.DEAD_END.value();
    }

    @Override
    public List<AnalysisIssue> check(GraphIndex index) {
        List<AnalysisIssue> issues = new ArrayList<>();
        for (Node node : index.graph().nodes()) {
            if (node.hasKind(NodeKind.CLUSTER) || node.hasKind(NodeKind.EXTERNAL) || node.hasKind(NodeKind.DOCUMENTATION)) {
                continue;
            }
            if (node.layer() < minLayer) {
                continue;
            }
            if (index.incomingCount(node.id()) > 0 && index.outgoingCount(node.id()) == 0) {
                issues.add(AnalysisIssue.of(
                    IssueKind.DEAD_END,
                    IssueSeverity.HIGH,
                    "Dead-end: no flow continues from '" + node.label() + "'",
                    List.of(node.id())
                ));
            }
        }
        return issues;
    }
}
