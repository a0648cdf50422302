package com.archlens.core.analyzer;

import com.archlens.core.model.AnalysisIssue;

import java.util.List;

/**
 * One structural check over an architecture graph.
 *
 * <p>Checks are independent and never mutate the graph. An empty result means the
 * graph passed.
 */
public interface HealthCheck {

    /**
     * Returns the check identifier, e.g. {@code "circular"}.
     *
     * @return check identifier
     */
    String getId();

    /**
     * Runs the check.
     *
     * @param index degree and adjacency view of the graph under analysis
     * @return issues found, in node or edge order
     */
    List<AnalysisIssue> check(GraphIndex index);
}
