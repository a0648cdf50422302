package com.archlens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Symbols and references extracted from one file.
 *
 * <p>Both lists keep insertion order and contain no duplicate names.
 *
 * @param path project-relative path of the summarized file
 * @param language detected language
 * @param symbols declared types and functions
 * @param references raw reference tokens
 */
public record FileSummary(
    String path,
    Language language,
    List<Symbol> symbols,
    List<Reference> references
) {
    /**
     * Compact constructor with validation.
     */
    public FileSummary {
        Objects.requireNonNull(path, "path must not be null");
        if (language == null) {
            language = Language.fromPath(path);
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        references = references == null ? List.of() : List.copyOf(references);
    }

    /**
     * Creates a summary with no findings.
     *
     * @param path file path
     * @return empty summary
     */
    public static FileSummary empty(String path) {
        return new FileSummary(path, null, List.of(), List.of());
    }

    /**
     * Returns the names of declared types.
     *
     * @return type names in insertion order
     */
    public List<String> types() {
        return namesOf(SymbolKind.TYPE);
    }

    /**
     * Returns the names of declared functions.
     *
     * @return function names in insertion order
     */
    public List<String> functions() {
        return namesOf(SymbolKind.FUNCTION);
    }

    /**
     * Returns the raw reference targets.
     *
     * @return reference tokens in insertion order
     */
    public List<String> referenceTokens() {
        return references.stream().map(Reference::target).toList();
    }

    public boolean hasFindings() {
        return !symbols.isEmpty() || !references.isEmpty();
    }

    private List<String> namesOf(SymbolKind kind) {
        return symbols.stream()
            .filter(symbol -> symbol.kind() == kind)
            .map(Symbol::name)
            .toList();
    }
}
