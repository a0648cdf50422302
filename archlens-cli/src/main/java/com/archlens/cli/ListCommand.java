package com.archlens.cli;

import com.archlens.core.analyzer.AnalyzerSettings;
import com.archlens.core.analyzer.GraphHealthAnalyzer;
import com.archlens.core.analyzer.HealthCheck;
import com.archlens.core.extractor.ExtractorRegistry;
import com.archlens.core.extractor.SymbolExtractor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list registered extractors or health checks.
 *
 * <p>Extractors are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all extractors
 * archlens list extractors
 *
 * # List the health checks in execution order
 * archlens list checks
 * }</pre>
 */
@Command(
    name = "list",
    description = "List registered extractors or health checks",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: extractors or checks (default: ${DEFAULT-VALUE})",
        defaultValue = "extractors"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "extractors", "extractor" -> listExtractors();
            case "checks", "check" -> listChecks();
            default -> {
                log.error("Unknown type: {}. Use: extractors or checks", type);
                yield 1;
            }
        };
    }

    private int listExtractors() {
        System.out.println("Available Extractors:");
        System.out.println();

        List<SymbolExtractor> extractors = ExtractorRegistry.loadDefault().getExtractors();
        for (SymbolExtractor extractor : extractors) {
            System.out.printf("  • %s (ID: %s)%n", extractor.getDisplayName(), extractor.getId());
            System.out.printf("    Languages: %s%n", extractor.getSupportedLanguages());
            System.out.printf("    Priority: %d%n", extractor.getPriority());
            System.out.println();
        }

        if (extractors.isEmpty()) {
            System.out.println("  No extractors found.");
        }
        return 0;
    }

    private int listChecks() {
        System.out.println("Health Checks (in execution order):");
        System.out.println();

        for (HealthCheck check : GraphHealthAnalyzer.defaultChecks(AnalyzerSettings.defaults())) {
            System.out.printf("  • %s%n", check.getId());
        }
        return 0;
    }
}
