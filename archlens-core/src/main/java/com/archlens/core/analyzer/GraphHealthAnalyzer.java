package com.archlens.core.analyzer;

import com.archlens.core.analyzer.check.BottleneckCheck;
import com.archlens.core.analyzer.check.CircularDependencyCheck;
import com.archlens.core.analyzer.check.DeadEndCheck;
import com.archlens.core.analyzer.check.IsolatedNodeCheck;
import com.archlens.core.analyzer.check.SchemaViolationCheck;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the structural health checks over an assembled graph.
 *
 * <p>The default checks run unconditionally, in this order: isolated nodes, circular
 * dependencies, dead-ends, bottlenecks, schema violations. Issues are returned in
 * check order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GraphHealthAnalyzer analyzer = new GraphHealthAnalyzer(AnalyzerSettings.from(config));
 * List<AnalysisIssue> issues = analyzer.analyze(graph);
 * }</pre>
 */
public class GraphHealthAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GraphHealthAnalyzer.class);

    private final List<HealthCheck> checks;

    public GraphHealthAnalyzer() {
        this(AnalyzerSettings.defaults());
    }

    public GraphHealthAnalyzer(AnalyzerSettings settings) {
        this(defaultChecks(Objects.requireNonNull(settings, "settings must not be null")));
    }

    public GraphHealthAnalyzer(List<HealthCheck> checks) {
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks must not be null"));
    }

    /**
     * Creates the default check list for the given thresholds.
     *
     * @param settings analyzer thresholds
     * @return checks in execution order
     */
    public static List<HealthCheck> defaultChecks(AnalyzerSettings settings) {
        return List.of(
            new IsolatedNodeCheck(),
            new CircularDependencyCheck(),
            new DeadEndCheck(settings.deadEndMinLayer()),
            new BottleneckCheck(settings.bottleneckThreshold()),
            new SchemaViolationCheck()
        );
    }

    public List<HealthCheck> getChecks() {
        return checks;
    }

    /**
     * Analyzes a graph.
     *
     * @param graph graph to analyze, left unchanged
     * @return issues of all checks
     */
    public List<AnalysisIssue> analyze(ArchitectureGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        GraphIndex index = GraphIndex.of(graph);

        List<AnalysisIssue> issues = new ArrayList<>();
        for (HealthCheck check : checks) {
            List<AnalysisIssue> found = check.check(index);
            log.debug("Check '{}' reported {} issues", check.getId(), found.size());
            issues.addAll(found);
        }

        log.info("Health analysis of {} nodes and {} edges found {} issues",
            graph.nodes().size(), graph.edges().size(), issues.size());
        return issues;
    }
}
