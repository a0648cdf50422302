package com.archlens.core.extractor.impl.brace;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link CppExtractor}.
 */
class CppExtractorTest extends ExtractorTestBase {

    private CppExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new CppExtractor();
    }

    @Test
    void extract_withClassAndMethods_findsTypesAndFunctions() {
        // Given: A C++ source with a class, a declaration and a qualified definition
        String content = """
            class Engine : public Base {
            public:
                void run();
            };

            struct Config {
                int retries;
            };

            int Engine::start(int x) {
                if (x > 0) {
                    return compute(x);
                }
                return 0;
            }
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/engine.cpp", content);

        // Then: Calls after 'return' and control keywords are not functions
        assertThat(summary.types()).containsExactly("Engine", "Config");
        assertThat(summary.functions()).contains("run", "Engine::start");
        assertThat(summary.functions()).doesNotContain("compute", "if");
    }

    @Test
    void extract_withConstructorDefinition_findsQualifiedName() {
        // Given: A constructor definition with an initializer list
        String content = """
            Engine::Engine(int x) : speed(x) {
            }
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "engine.cc", content);

        // Then: The qualified constructor is reported
        assertThat(summary.functions()).containsExactly("Engine::Engine");
    }

    @Test
    void extract_withIncludes_separatesLocalStandardAndThirdParty() {
        // Given: Quoted, standard and third-party includes
        String content = """
            #include "engine.h"
            #include "util/strings.hpp"
            #include <vector>
            #include <stdio.h>
            #include <boost/asio.hpp>
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/main.cpp", content);

        // Then: Standard headers are dropped, third-party reduced to the library
        assertThat(localReferences(summary)).containsExactly("engine.h", "util/strings.hpp");
        assertThat(externalReferences(summary)).containsExactly("boost");
    }
}
