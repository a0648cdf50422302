package com.archlens.core.discovery;

import com.archlens.core.model.NodeKind;
import com.archlens.core.model.StructureFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FileClassifier}.
 */
class FileClassifierTest {

    @ParameterizedTest
    @CsvSource({
        "README.md,                  DOCUMENTATION",
        "docs/tests/guide.md,        DOCUMENTATION",
        "tests/app.ts,               TEST",
        "src/__tests__/engine.ts,    TEST",
        "pkg/test_models.py,         TEST",
        "pkg/models_test.py,         TEST",
        "src/engine.spec.ts,         TEST",
        "src/engine.test.js,         TEST",
        "tests/fixtures.json,        TEST",
        "config/app.yaml,            CONFIG",
        "Cargo.toml,                 CONFIG",
        "src/contest.ts,             SOURCE",
        "src/testing.py,             SOURCE",
        "src/main.rs,                SOURCE"
    })
    void classify_returnsKindFromPath(String path, NodeKind expected) {
        assertThat(FileClassifier.classify(path)).isEqualTo(expected);
    }

    @Test
    void toStructureFile_describesFileAsAutoDetected() {
        StructureFile file = FileClassifier.toStructureFile("src/core/engine.ts");

        assertThat(file.path()).isEqualTo("src/core/engine.ts");
        assertThat(file.kind()).isEqualTo(NodeKind.SOURCE);
        assertThat(file.description()).isEqualTo("engine.ts (auto-detected)");
    }
}
