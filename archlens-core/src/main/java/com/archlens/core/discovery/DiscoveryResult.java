package com.archlens.core.discovery;

import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.FileSummary;

import java.util.List;
import java.util.Objects;

/**
 * Output of one discovery cycle.
 *
 * @param graph assembled graph
 * @param summaries per-file extraction results, in path order
 * @param issues health issues of the graph
 */
public record DiscoveryResult(
    ArchitectureGraph graph,
    List<FileSummary> summaries,
    List<AnalysisIssue> issues
) {
    /**
     * Compact constructor with validation.
     */
    public DiscoveryResult {
        Objects.requireNonNull(graph, "graph must not be null");
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
