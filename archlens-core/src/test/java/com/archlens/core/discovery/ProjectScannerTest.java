package com.archlens.core.discovery;

import com.archlens.core.extractor.ExtractorRegistry;
import com.archlens.core.extractor.SymbolExtractor;
import com.archlens.core.model.FileSummary;
import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProjectScanner}.
 */
class ProjectScannerTest extends DiscoveryTestBase {

    @Test
    void scanAll_withManyFiles_keepsInputOrder() throws IOException {
        // Given: More files than worker threads
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String path = "src/module" + i + ".py";
            createFile(path, "def handler" + i + "():\n    pass\n");
            paths.add(path);
        }
        ProjectScanner scanner = new ProjectScanner(
            new ProjectFileTree(tempDir, IgnoreRules.defaults()), ExtractorRegistry.loadDefault(), 3);

        // When: Scanning all files
        List<FileSummary> summaries = scanner.scanAll(paths);

        // Then: Summary i belongs to path i
        assertThat(summaries).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(summaries.get(i).path()).isEqualTo(paths.get(i));
            assertThat(summaries.get(i).functions()).containsExactly("handler" + i);
        }
    }

    @Test
    void scanFile_withRelativeAndAbsolutePaths_returnsSameSummary() throws IOException {
        // Given: A Rust file
        createFile("src/lib.rs", "pub fn start() {}\n");
        ProjectScanner scanner = new ProjectScanner(
            new ProjectFileTree(tempDir, IgnoreRules.defaults()), ExtractorRegistry.loadDefault(), 1);

        // When: Scanning by relative and absolute path
        FileSummary relative = scanner.scanFile(Path.of("src/lib.rs"));
        FileSummary absolute = scanner.scanFile(tempDir.resolve("src/lib.rs"));

        // Then: Both identify the file by its project-relative path
        assertThat(relative).isEqualTo(absolute);
        assertThat(relative.path()).isEqualTo("src/lib.rs");
        assertThat(relative.functions()).containsExactly("start");
    }

    @Test
    void scanFile_withMissingFile_returnsEmptySummary() {
        ProjectScanner scanner = new ProjectScanner(
            new ProjectFileTree(tempDir, IgnoreRules.defaults()), ExtractorRegistry.loadDefault(), 1);

        FileSummary summary = scanner.scanFile(tempDir.resolve("gone.ts"));

        assertThat(summary.path()).isEqualTo("gone.ts");
        assertThat(summary.hasFindings()).isFalse();
    }

    @Test
    void scanAll_withFailingExtractor_isolatesTheFailure() throws IOException {
        // Given: An extractor that throws for every file
        createFile("a.sql", "CREATE TABLE a (id INT);");
        createFile("b.sql", "CREATE TABLE b (id INT);");
        ExtractorRegistry registry = new ExtractorRegistry(List.of(new FailingExtractor()));
        ProjectScanner scanner = new ProjectScanner(new ProjectFileTree(tempDir, IgnoreRules.defaults()), registry, 2);

        // When: Scanning
        List<FileSummary> summaries = scanner.scanAll(List.of("a.sql", "b.sql"));

        // Then: Each file gets an empty summary
        assertThat(summaries).extracting(FileSummary::path).containsExactly("a.sql", "b.sql");
        assertThat(summaries).noneMatch(FileSummary::hasFindings);
    }

    @Test
    void constructor_withNonPositiveConcurrency_throws() {
        ProjectFileTree tree = new ProjectFileTree(tempDir, IgnoreRules.defaults());
        ExtractorRegistry registry = ExtractorRegistry.loadDefault();

        assertThatThrownBy(() -> new ProjectScanner(tree, registry, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class FailingExtractor implements SymbolExtractor {

        @Override
        public String getId() {
            return "failing";
        }

        @Override
        public String getDisplayName() {
            return "Failing Extractor";
        }

        @Override
        public Set<Language> getSupportedLanguages() {
            return Set.of(Language.SQL);
        }

        @Override
        public FileSummary extract(SourceFile file) {
            throw new IllegalStateException("boom");
        }
    }
}
