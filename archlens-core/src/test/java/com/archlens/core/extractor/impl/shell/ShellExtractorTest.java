package com.archlens.core.extractor.impl.shell;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ShellExtractor}.
 */
class ShellExtractorTest extends ExtractorTestBase {

    private final ShellExtractor extractor = new ShellExtractor();

    @Test
    void extract_withFunctionsAndSourcedScripts_findsBoth() {
        // Given: A deploy script
        String content = """
            #!/usr/bin/env bash
            # source ignored.sh
            source lib/env.sh
            . ./common.sh

            function deploy() {
              bash ./build.sh
              ./scripts/test.sh && echo done
              sh "$HOME/tools/run.sh"
            }

            cleanup() {
              rm -rf out
            }
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "deploy.sh", content);

        // Then: Comments and variable paths are ignored
        assertThat(summary.functions()).containsExactly("deploy", "cleanup");
        assertThat(summary.referenceTokens())
            .containsExactlyInAnyOrder("lib/env.sh", "./common.sh", "./build.sh", "./scripts/test.sh");
    }
}
