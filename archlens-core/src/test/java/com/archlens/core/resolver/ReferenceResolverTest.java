package com.archlens.core.resolver;

import com.archlens.core.model.Dependency;
import com.archlens.core.model.Reference;
import com.archlens.core.model.ReferenceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link ReferenceResolver}.
 */
class ReferenceResolverTest {

    private final ReferenceResolver resolver = new ReferenceResolver();

    @Test
    void resolveDependencies_withRelativeImport_producesSingleEdge() {
        // Given: a.ts imports './b' and b.ts exists
        List<String> files = List.of("a.ts", "b.ts");
        List<Reference> references = List.of(local("a.ts", "./b"));

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: Exactly one dependency a.ts -> b.ts
        assertThat(result.dependencies())
            .extracting(Dependency::from, Dependency::to)
            .containsExactly(tuple("a.ts", "b.ts"));
        assertThat(result.externalTokens()).isEmpty();
    }

    @Test
    void resolveDependencies_withParentDirectoryImport_resolvesAgainstReferencingFile() {
        // Given: A Python relative import rewritten to a parent path
        List<String> files = List.of("app/api/routes.py", "app/utils/helpers.py");
        List<Reference> references = List.of(local("app/api/routes.py", "../utils/helpers"));

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: The extension is appended and the file found
        assertThat(result.dependencies()).extracting(Dependency::to).containsExactly("app/utils/helpers.py");
    }

    @Test
    void resolveDependencies_withUnresolvedPackage_createsExternalDependency() {
        // Given: Package imports that match no project file
        List<String> files = List.of("src/app.ts");
        List<Reference> references = List.of(
            external("src/app.ts", "lodash"),
            external("src/app.ts", "@nestjs/common")
        );

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: Both become external modules
        assertThat(result.dependencies())
            .extracting(Dependency::to)
            .containsExactly("external:lodash", "external:@nestjs/common");
        assertThat(result.dependencies()).allMatch(Dependency::targetsExternal);
        assertThat(result.externalTokens()).containsExactly("lodash", "@nestjs/common");
    }

    @Test
    void resolveDependencies_withSelfReference_dropsIt() {
        // Given: A file importing itself
        List<String> files = List.of("a.ts");
        List<Reference> references = List.of(local("a.ts", "./a"));

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: No dependency is produced
        assertThat(result.dependencies()).isEmpty();
    }

    @Test
    void resolveDependencies_withUnresolvableLocalPath_dropsIt() {
        // Given: Local and path-like tokens that match nothing
        List<String> files = List.of("a.ts");
        List<Reference> references = List.of(
            local("a.ts", "./missing"),
            external("a.ts", "some/deep/path")
        );

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: Neither becomes an external module
        assertThat(result.dependencies()).isEmpty();
        assertThat(result.externalTokens()).isEmpty();
    }

    @Test
    void resolveDependencies_withRepeatedReference_deduplicates() {
        // Given: The same import written twice
        List<String> files = List.of("a.ts", "b.ts");
        List<Reference> references = List.of(local("a.ts", "./b"), local("a.ts", "./b.ts"));

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: One dependency
        assertThat(result.dependencies()).hasSize(1);
    }

    @Test
    void resolveDependencies_withModuleToken_matchesByBaseName() {
        // Given: A Rust module token and a dotted Python module
        List<String> files = List.of("src/main.rs", "src/parser.rs", "app.py", "pkg/mod.py");
        List<Reference> references = List.of(
            local("src/main.rs", "parser"),
            external("app.py", "pkg.mod")
        );

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: Both resolve to project files
        assertThat(result.dependencies())
            .extracting(Dependency::from, Dependency::to)
            .containsExactly(tuple("src/main.rs", "src/parser.rs"), tuple("app.py", "pkg/mod.py"));
    }

    @Test
    void resolveDependencies_withAmbiguousToken_picksFirstSortedCandidate() {
        // Given: Two files sharing a base name, listed out of order
        List<String> files = List.of("c.ts", "zeta/util.ts", "alpha/util.ts");
        List<Reference> references = List.of(external("c.ts", "util"));

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: The lexicographically first path wins
        assertThat(result.dependencies()).extracting(Dependency::to).containsExactly("alpha/util.ts");
    }

    @Test
    void resolveDependencies_withQuotedInclude_resolvesInSameDirectory() {
        // Given: A C include next to the source
        List<String> files = List.of("src/main.cpp", "src/engine.h", "include/engine.h");
        List<Reference> references = List.of(
            new Reference("src/main.cpp", "engine.h", ReferenceKind.INCLUDE, true)
        );

        // When: Resolving
        ResolutionResult result = resolver.resolveDependencies(files, references);

        // Then: The sibling header wins and the label records the origin
        assertThat(result.dependencies())
            .extracting(Dependency::to, Dependency::label)
            .containsExactly(tuple("src/engine.h", "include"));
    }

    @Test
    void isPlausibleModule_classifiesTokens() {
        assertThat(ReferenceResolver.isPlausibleModule("requests")).isTrue();
        assertThat(ReferenceResolver.isPlausibleModule("@scope/pkg")).isTrue();
        assertThat(ReferenceResolver.isPlausibleModule("numpy.linalg")).isTrue();
        assertThat(ReferenceResolver.isPlausibleModule("./local")).isFalse();
        assertThat(ReferenceResolver.isPlausibleModule("a/b/c")).isFalse();
        assertThat(ReferenceResolver.isPlausibleModule("")).isFalse();
    }

    private static Reference local(String from, String token) {
        return new Reference(from, token, ReferenceKind.IMPORT, true);
    }

    private static Reference external(String from, String token) {
        return new Reference(from, token, ReferenceKind.IMPORT, false);
    }
}
