package com.archlens.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.archlens.core.config.ConfigLoader;
import com.archlens.core.config.ProjectConfig;
import com.archlens.core.discovery.ArchitectureDiscovery;
import com.archlens.core.discovery.DiscoveryResult;
import com.archlens.core.generator.HealthReportGenerator;
import com.archlens.core.generator.MermaidGraphGenerator;
import com.archlens.core.model.IssueSeverity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to discover a project and write its architecture outputs.
 *
 * <p>Runs one discovery cycle and writes three files to the output directory:
 * <ul>
 *   <li>{@code architecture-graph.json} - nodes, edges and clusters</li>
 *   <li>{@code architecture.mmd} - Mermaid flowchart of the graph</li>
 *   <li>{@code health-report.md} - Markdown health report</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * archlens scan
 *
 * # Scan specific directory into a custom output directory
 * archlens scan /path/to/project -o /tmp/archlens
 *
 * # Dry run (no output written)
 * archlens scan --dry-run
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Discover a project and write graph, diagram and health report",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    static final String GRAPH_FILE = "architecture-graph.json";
    static final String DIAGRAM_FILE = "architecture.mmd";
    static final String REPORT_FILE = "health-report.md";

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: archlens.yaml in the project directory)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--dry-run"},
        description = "Run discovery but don't write output"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            log.info("Starting scan of: {}", root);
            System.out.println("Scanning project: " + root);
            System.out.println();

            if (!Files.isDirectory(root)) {
                System.err.println("✗ Not a directory: " + root);
                return 1;
            }

            ProjectConfig config = loadConfiguration(root);
            DiscoveryResult result = new ArchitectureDiscovery(config).discover(root);
            printSummary(result);

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping output");
                return 0;
            }

            Path output = resolveOutputDirectory(root, config);
            writeOutputs(result, output);
            System.out.println("✓ Wrote output to: " + output);

            System.out.println();
            System.out.println("✓ Scan complete");
            return 0;

        } catch (Exception e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    private ProjectConfig loadConfiguration(Path root) {
        if (configPath == null) {
            return ConfigLoader.loadFromProject(root);
        }
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : root.resolve(configPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    private Path resolveOutputDirectory(Path root, ProjectConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().normalize();
        }
        return root.resolve(config.output().directory()).normalize();
    }

    private void printSummary(DiscoveryResult result) {
        System.out.println("✓ Extracted " + result.summaries().size() + " files");
        System.out.println("✓ Assembled " + result.graph().nodes().size() + " nodes, "
            + result.graph().edges().size() + " edges, "
            + result.graph().clusters().size() + " clusters");

        long critical = result.issues().stream().filter(issue -> issue.severity() == IssueSeverity.CRITICAL).count();
        System.out.println("✓ Found " + result.issues().size() + " health issues (" + critical + " critical)");
    }

    private void writeOutputs(DiscoveryResult result, Path output) throws IOException {
        Files.createDirectories(output);

        JsonOutput.mapper().writeValue(output.resolve(GRAPH_FILE).toFile(), result.graph());

        String diagram = new MermaidGraphGenerator().generateGraph(result.graph());
        Files.writeString(output.resolve(DIAGRAM_FILE), diagram, StandardCharsets.UTF_8);

        String report = new HealthReportGenerator().generateReport(result.issues(), result.graph());
        Files.writeString(output.resolve(REPORT_FILE), report, StandardCharsets.UTF_8);

        log.debug("Wrote {}, {} and {} to {}", GRAPH_FILE, DIAGRAM_FILE, REPORT_FILE, output);
    }
}
