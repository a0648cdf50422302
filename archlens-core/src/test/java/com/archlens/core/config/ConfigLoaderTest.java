package com.archlens.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_withFullConfig_readsEverySection() throws IOException {
        // Given: A complete archlens.yaml
        Files.writeString(tempDir.resolve("archlens.yaml"), """
            project:
              name: "demo"
              description: "Demo project"
            scan:
              includePaths: [src, lib]
              ignoreFolders: [generated]
              ignoreFiles: [secrets.json]
              binaryExtensions: [.woff]
              maxConcurrency: 2
            flow:
              maxLines: 120
            analysis:
              bottleneckThreshold: 3
              deadEndMinLayer: 2
            output:
              directory: "./reports"
            unknownSection:
              ignored: true
            """);

        // When: Loading from the project root
        ProjectConfig config = ConfigLoader.loadFromProject(tempDir);

        // Then: All values are bound
        assertThat(config.project().name()).isEqualTo("demo");
        assertThat(config.scan().includePaths()).containsExactly("src", "lib");
        assertThat(config.scan().ignoreFolders()).containsExactly("generated");
        assertThat(config.scan().ignoreFiles()).containsExactly("secrets.json");
        assertThat(config.scan().binaryExtensions()).containsExactly(".woff");
        assertThat(config.scan().effectiveMaxConcurrency()).isEqualTo(2);
        assertThat(config.flow().effectiveMaxLines()).isEqualTo(120);
        assertThat(config.analysis().effectiveBottleneckThreshold()).isEqualTo(3);
        assertThat(config.analysis().effectiveDeadEndMinLayer()).isEqualTo(2);
        assertThat(config.output().directory()).isEqualTo("./reports");
    }

    @Test
    void load_withPartialConfig_fillsDefaults() throws IOException {
        // Given: Only the flow section
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "flow:\n  maxLines: 0\n");

        // When: Loading
        ProjectConfig config = ConfigLoader.load(file);

        // Then: Missing or invalid values fall back to defaults
        assertThat(config.flow().effectiveMaxLines()).isEqualTo(ProjectConfig.DEFAULT_FLOW_MAX_LINES);
        assertThat(config.scan().effectiveMaxConcurrency()).isEqualTo(ProjectConfig.DEFAULT_MAX_CONCURRENCY);
        assertThat(config.scan().includePaths()).isEmpty();
        assertThat(config.output().directory()).isEqualTo("./archlens-out");
    }

    @Test
    void load_withMissingFile_returnsDefaults() {
        assertThat(ConfigLoader.loadFromProject(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_withMalformedYaml_returnsDefaults() throws IOException {
        // Given: Invalid YAML
        Path file = tempDir.resolve("archlens.yaml");
        Files.writeString(file, "scan: [unclosed\n  - : :");

        // When/Then: Defaults are used
        assertThat(ConfigLoader.load(file)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_withEmptyFile_returnsDefaults() throws IOException {
        Path file = tempDir.resolve("archlens.yaml");
        Files.writeString(file, "");

        assertThat(ConfigLoader.load(file)).isEqualTo(ProjectConfig.defaults());
    }
}
