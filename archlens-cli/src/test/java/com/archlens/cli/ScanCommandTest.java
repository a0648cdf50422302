package com.archlens.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ScanCommand}.
 */
class ScanCommandTest extends CommandTestBase {

    @Test
    void scan_withOutputOption_writesGraphDiagramAndReport() throws IOException {
        // Given: A small project
        Path project = createProject();
        Path output = tempDir.resolve("out");

        // When: Scanning into a custom directory
        int exitCode = run("scan", project.toString(), "-o", output.toString());

        // Then: All three outputs are written
        assertThat(exitCode).isZero();
        assertThat(output.resolve(ScanCommand.GRAPH_FILE)).exists();
        assertThat(Files.readString(output.resolve(ScanCommand.GRAPH_FILE)))
            .contains("\"nodes\"", "src/app.ts", "src/engine.ts");
        assertThat(Files.readString(output.resolve(ScanCommand.DIAGRAM_FILE))).startsWith("flowchart TD");
        assertThat(Files.readString(output.resolve(ScanCommand.REPORT_FILE)))
            .startsWith("# ArchLens Architecture Health Report");
        assertThat(stdout()).contains("Extracted 2 files", "Scan complete");
    }

    @Test
    void scan_withoutOutputOption_writesToConfiguredDirectory() throws IOException {
        // Given: A project whose configuration names the output directory
        Path project = createProject();
        createFile("project/archlens.yaml", "output:\n  directory: docs/generated\n");

        // When: Scanning
        int exitCode = run("scan", project.toString());

        // Then: Output lands below the project root
        assertThat(exitCode).isZero();
        assertThat(project.resolve("docs/generated").resolve(ScanCommand.GRAPH_FILE)).exists();
    }

    @Test
    void scan_withDryRun_writesNothing() throws IOException {
        Path project = createProject();

        int exitCode = run("scan", project.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(project.resolve("archlens-out")).doesNotExist();
        assertThat(stdout()).contains("Dry-run mode");
    }

    @Test
    void scan_withFileInsteadOfDirectory_fails() throws IOException {
        Path file = createFile("single.ts", "export const x = 1;\n");

        int exitCode = run("scan", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Not a directory");
    }
}
