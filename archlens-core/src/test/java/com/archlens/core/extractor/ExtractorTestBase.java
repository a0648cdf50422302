package com.archlens.core.extractor;

import com.archlens.core.model.FileSummary;
import com.archlens.core.model.Reference;
import com.archlens.core.model.SourceFile;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base class for extractor functional tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Temporary directory creation for test projects</li>
 *   <li>Helper methods for creating test files</li>
 *   <li>Shortcuts for extracting in-memory files</li>
 * </ul>
 */
public abstract class ExtractorTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "src/app.ts")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Extracts an in-memory file.
     *
     * @param extractor extractor under test
     * @param path project-relative path, its extension selects the language
     * @param content file content
     * @return summary
     */
    protected FileSummary extract(SymbolExtractor extractor, String path, String content) {
        return extractor.extract(SourceFile.of(path, content));
    }

    protected List<String> localReferences(FileSummary summary) {
        return summary.references().stream().filter(Reference::local).map(Reference::target).toList();
    }

    protected List<String> externalReferences(FileSummary summary) {
        return summary.references().stream().filter(reference -> !reference.local()).map(Reference::target).toList();
    }
}
