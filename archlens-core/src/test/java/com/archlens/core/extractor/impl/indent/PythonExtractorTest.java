package com.archlens.core.extractor.impl.indent;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link PythonExtractor}.
 */
class PythonExtractorTest extends ExtractorTestBase {

    private PythonExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new PythonExtractor();
    }

    @Test
    void extract_withClassesAndFunctions_findsSymbols() {
        // Given: A module with a class, methods and an async function
        String content = """
            class Board(Base):
                def __init__(self):
                    self.items = []

                def add(self, item):
                    self.items.append(item)

            async def refresh():
                pass
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "demo/src/board.py", content);

        // Then: All declarations are found in order
        assertThat(summary.types()).containsExactly("Board");
        assertThat(summary.functions()).containsExactly("__init__", "add", "refresh");
    }

    @Test
    void extract_withImportLists_splitsAndStripsAliases() {
        // Given: Comma-separated imports with aliases and standard modules
        String content = """
            import os, requests as rq, numpy.linalg
            from flask import Flask, request
            from typing import List
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "app.py", content);

        // Then: Standard modules are dropped, aliases stripped
        assertThat(externalReferences(summary)).containsExactly("requests", "numpy.linalg", "flask");
    }

    @Test
    void extract_withRelativeImports_rewritesToPaths() {
        // Given: Relative from-imports at several depths
        String content = """
            from .models import User
            from ..utils.helpers import slugify
            from . import views, forms as f
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "app/api/routes.py", content);

        // Then: Dots become path prefixes
        assertThat(localReferences(summary))
            .containsExactly("./models", "../utils/helpers", "./views", "./forms");
    }
}
