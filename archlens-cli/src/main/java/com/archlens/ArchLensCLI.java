package com.archlens;

import com.archlens.cli.AnalyzeCommand;
import com.archlens.cli.FlowCommand;
import com.archlens.cli.ListCommand;
import com.archlens.cli.ScanCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for ArchLens.
 *
 * <p>ArchLens turns a multi-language source tree into a dependency graph, reconstructs
 * per-file control flow, and reports structural health issues of the graph.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Discover a project and write graph, diagram and health report</li>
 *   <li>{@code flow} - Reconstruct the control flow of one file</li>
 *   <li>{@code analyze} - Re-analyze a persisted graph</li>
 *   <li>{@code list} - List registered extractors or health checks</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * archlens scan
 *
 * # Scan with verbose output
 * archlens -v scan ../my-project
 *
 * # Print the flow of a file as Mermaid
 * archlens flow src/app.ts --format mermaid
 * }</pre>
 */
@Command(
    name = "archlens",
    mixinStandardHelpOptions = true,
    version = "ArchLens 1.0.0-SNAPSHOT",
    description = "Dependency graph, control flow and architecture health for multi-language projects",
    subcommands = {
        ScanCommand.class,
        FlowCommand.class,
        AnalyzeCommand.class,
        ListCommand.class
    }
)
public class ArchLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ArchLensCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("ArchLens - Architecture graphs for multi-language projects");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'archlens --help' to see available commands");
        System.out.println("Use 'archlens <command> --help' for command-specific help");
    }

    /**
     * Applies the global options before the selected subcommand runs.
     *
     * @param parseResult parsed command line
     * @return exit code of the executed command
     */
    int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Creates the command line with global option handling installed.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        ArchLensCLI cli = new ArchLensCLI();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
