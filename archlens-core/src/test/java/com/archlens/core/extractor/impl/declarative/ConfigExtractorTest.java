package com.archlens.core.extractor.impl.declarative;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ConfigExtractor}.
 */
class ConfigExtractorTest extends ExtractorTestBase {

    private final ConfigExtractor extractor = new ConfigExtractor();

    @Test
    void extract_withJsonExtends_findsScalarAndArrayValues() {
        // Given: A tsconfig with scalar and array references
        String content = """
            {
              "extends": "./tsconfig.base.json",
              "include": ["src/shared.json", "https://example.com/schema.json"],
              "compilerOptions": { "strict": true }
            }
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "tsconfig.json", content);

        // Then: URLs are skipped, relative values are local
        assertThat(localReferences(summary)).containsExactly("./tsconfig.base.json");
        assertThat(externalReferences(summary)).containsExactly("src/shared.json");
    }

    @Test
    void extract_withYamlAndToml_findsIncludes() {
        // When: Extracting a YAML file and a TOML file
        FileSummary yaml = extract(extractor, "ci/pipeline.yml", """
            include: ./shared/base.yml  # common steps
            name: build
            """);
        FileSummary toml = extract(extractor, "config/app.toml", """
            source = "defaults.toml"
            """);

        // Then: Each file reports its reference
        assertThat(yaml.referenceTokens()).containsExactly("./shared/base.yml");
        assertThat(toml.referenceTokens()).containsExactly("defaults.toml");
    }
}
