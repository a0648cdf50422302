package com.archlens.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.archlens.core.analyzer.AnalyzerSettings;
import com.archlens.core.analyzer.GraphHealthAnalyzer;
import com.archlens.core.config.ProjectConfig;
import com.archlens.core.generator.HealthReportGenerator;
import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to re-run the health analysis on a persisted graph.
 *
 * <p>Reads a graph written by {@code archlens scan} (or by any collaborator using the
 * same JSON shape) and prints or writes the Markdown health report.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archlens analyze archlens-out/architecture-graph.json
 * archlens analyze graph.json --bottleneck-threshold 8 -o report.md
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a persisted architecture graph",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(index = "0", description = "Graph JSON file")
    private Path graphFile;

    @Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of standard output"
    )
    private Path reportFile;

    @Option(
        names = {"--bottleneck-threshold"},
        description = "Incoming edges that mark a bottleneck (default: ${DEFAULT-VALUE})",
        defaultValue = "" + ProjectConfig.DEFAULT_BOTTLENECK_THRESHOLD
    )
    private int bottleneckThreshold;

    @Option(
        names = {"--dead-end-min-layer"},
        description = "Lowest layer checked for dead-ends (default: ${DEFAULT-VALUE})",
        defaultValue = "" + ProjectConfig.DEFAULT_DEAD_END_MIN_LAYER
    )
    private int deadEndMinLayer;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(graphFile)) {
                System.err.println("✗ Graph file not found: " + graphFile);
                return 1;
            }

            ArchitectureGraph graph = JsonOutput.mapper().readValue(graphFile.toFile(), ArchitectureGraph.class);
            log.info("Loaded graph with {} nodes and {} edges from {}",
                graph.nodes().size(), graph.edges().size(), graphFile);

            AnalyzerSettings settings = new AnalyzerSettings(bottleneckThreshold, deadEndMinLayer);
            List<AnalysisIssue> issues = new GraphHealthAnalyzer(settings).analyze(graph);
            String report = new HealthReportGenerator().generateReport(issues, graph);

            if (reportFile != null) {
                Files.writeString(reportFile, report, StandardCharsets.UTF_8);
                System.out.println("✓ Found " + issues.size() + " issues, report written to: " + reportFile);
            } else {
                System.out.println(report);
            }
            return 0;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
