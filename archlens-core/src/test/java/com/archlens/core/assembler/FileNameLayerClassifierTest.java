package com.archlens.core.assembler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FileNameLayerClassifier}.
 */
class FileNameLayerClassifierTest {

    private final FileNameLayerClassifier classifier = new FileNameLayerClassifier();

    @ParameterizedTest
    @CsvSource({
        "src/main.ts,               0, 5",
        "src/scanner.ts,            0, 8",
        "src/parser.rs,             0, 10",
        "src/router.ts,             1, 20",
        "src/engine.cpp,            1, 25",
        "app/service.py,            1, 30",
        "app/maintenance.py,        1, 25",
        "src/logic.js,              1, 30",
        "src/util.ts,               1, 50",
        "src/db.ts,                 2, 70",
        "src/storage.rs,            2, 80",
        "src/action_runner.ts,      2, 90",
        "docs/guide.md,             0, 1"
    })
    void classify_withKnownMarkers_returnsLayerAndPriority(String path, int layer, int priority) {
        assertThat(classifier.classify(path)).isEqualTo(new LayerHint(layer, priority));
    }
}
