package com.archlens.core.discovery;

import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProjectFileTree}.
 */
class ProjectFileTreeTest extends DiscoveryTestBase {

    @Test
    void walk_withSampleProject_listsRecognizedFilesOnly() throws IOException {
        // Given: A project with ignored folders, binaries and unknown file types
        createSampleProject();

        // When: Walking
        TreeListing listing = new ProjectFileTree(tempDir, IgnoreRules.defaults()).walk();

        // Then: Only recognized, non-ignored files in sorted order
        assertThat(listing.files()).containsExactly(
            "README.md", "src/app.ts", "src/core/engine.ts", "tests/app.test.ts");
        assertThat(listing.directories()).containsExactly("assets", "src", "src/core", "tests");
    }

    @Test
    void walk_withIncludePaths_restrictsScope() throws IOException {
        // Given: A sample project and include paths, one escaping the root
        createSampleProject();
        ProjectFileTree tree = new ProjectFileTree(tempDir, IgnoreRules.defaults(),
            List.of("src/core", "../outside", "missing"));

        // When: Walking
        TreeListing listing = tree.walk();

        // Then: Only the included subtree is listed
        assertThat(listing.files()).containsExactly("src/core/engine.ts");
        assertThat(listing.directories()).containsExactly("src/core");
    }

    @Test
    void walk_withMissingRoot_returnsEmptyListing() {
        // When: Walking a directory that does not exist
        TreeListing listing = new ProjectFileTree(tempDir.resolve("nope"), IgnoreRules.defaults()).walk();

        // Then: Nothing is listed and nothing is thrown
        assertThat(listing.files()).isEmpty();
        assertThat(listing.directories()).isEmpty();
    }

    @Test
    void read_withExistingAndMissingFiles_returnsContentOrEmpty() throws IOException {
        // Given: One file on disk
        createFile("src/app.ts", "export const x = 1;\n");
        ProjectFileTree tree = new ProjectFileTree(tempDir, IgnoreRules.defaults());

        // When: Reading it and a missing file
        SourceFile existing = tree.read("./src/app.ts");
        SourceFile missing = tree.read("src/missing.ts");

        // Then: Content and language are set, the missing file is empty
        assertThat(existing.path()).isEqualTo("src/app.ts");
        assertThat(existing.language()).isEqualTo(Language.TYPESCRIPT);
        assertThat(existing.content()).contains("export const x");
        assertThat(missing.content()).isEmpty();
    }
}
