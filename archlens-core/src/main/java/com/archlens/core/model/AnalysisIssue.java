package com.archlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A structural issue found in an architecture graph.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * AnalysisIssue issue = AnalysisIssue.of(
 *     IssueKind.BOTTLENECK,
 *     IssueSeverity.MEDIUM,
 *     "Possible bottleneck: 'db.ts' has 7 incoming dependencies",
 *     List.of("node_3f2a...")
 * );
 * }</pre>
 *
 * @param kind issue kind
 * @param severity severity
 * @param message human-readable description
 * @param nodeIds ids of the implicated nodes, may be empty
 */
public record AnalysisIssue(
    IssueKind kind,
    IssueSeverity severity,
    String message,
    List<String> nodeIds
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisIssue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }

    public static AnalysisIssue of(IssueKind kind, IssueSeverity severity, String message, List<String> nodeIds) {
        return new AnalysisIssue(kind, severity, message, nodeIds);
    }
}
