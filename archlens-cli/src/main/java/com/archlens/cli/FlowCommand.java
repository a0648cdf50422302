package com.archlens.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.archlens.core.flow.FlowReconstructor;
import com.archlens.core.generator.MermaidGraphGenerator;
import com.archlens.core.model.StepGraph;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to reconstruct the control flow of one source file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the step graph as JSON
 * archlens flow src/app.ts
 *
 * # Print a Mermaid flowchart, examining at most 200 lines
 * archlens flow src/app.py --format mermaid --max-lines 200
 * }</pre>
 */
@Command(
    name = "flow",
    description = "Reconstruct the control flow of a source file",
    mixinStandardHelpOptions = true
)
public class FlowCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FlowCommand.class);

    /**
     * Output formats of the step graph.
     */
    public enum Format {
        JSON,
        MERMAID
    }

    @Parameters(index = "0", description = "Source file")
    private Path file;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "JSON"
    )
    private Format format;

    @Option(
        names = {"--max-lines"},
        description = "Maximum number of lines examined (default: ${DEFAULT-VALUE})",
        defaultValue = "" + FlowReconstructor.DEFAULT_MAX_LINES
    )
    private int maxLines;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(file)) {
                System.err.println("✗ File not found: " + file);
                return 1;
            }

            StepGraph stepGraph = new FlowReconstructor(maxLines).scanForFlow(file);
            log.debug("Reconstructed {} steps for {}", stepGraph.steps().size(), file);

            String output = switch (format) {
                case JSON -> JsonOutput.mapper().writeValueAsString(stepGraph);
                case MERMAID -> new MermaidGraphGenerator().generateFlow(stepGraph);
            };
            System.out.println(output);
            return 0;

        } catch (Exception e) {
            log.error("Flow reconstruction failed", e);
            System.err.println("✗ Flow reconstruction failed: " + e.getMessage());
            return 1;
        }
    }
}
