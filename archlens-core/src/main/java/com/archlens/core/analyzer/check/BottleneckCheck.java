package com.archlens.core.analyzer.check;

import com.archlens.core.analyzer.GraphIndex;
import com.archlens.core.analyzer.HealthCheck;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.IssueKind;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports nodes whose incoming edge count reaches the threshold.
 */
public class BottleneckCheck implements HealthCheck {

    private final int threshold;

    public BottleneckCheck(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public String getId() {
        return IssueKind.BOTTLENECK.value();
    }

    @Override
    public List<AnalysisIssue> check(GraphIndex index) {
        List<AnalysisIssue> issues = new ArrayList<>();
        for (Node node : index.graph().nodes()) {
            int incoming = index.incomingCount(node.id());
            if (incoming >= threshold) {
                issues.add(AnalysisIssue.of(
                    IssueKind.BOTTLENECK,
                    IssueSeverity.MEDIUM,
                    "Possible bottleneck: '" + node.label() + "' has " + incoming + " incoming dependencies",
                    List.of(node.id())
                ));
            }
        }
        return issues;
    }
}
