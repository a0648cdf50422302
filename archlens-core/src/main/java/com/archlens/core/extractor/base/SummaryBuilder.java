package com.archlens.core.extractor.base;

import com.archlens.core.model.FileSummary;
import com.archlens.core.model.Language;
import com.archlens.core.model.Reference;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.Symbol;
import com.archlens.core.model.SymbolKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates the findings of one file.
 *
 * <p>Keeps insertion order, drops duplicate names per symbol kind and duplicate
 * reference targets, and filters function names that collide with language
 * keywords (an {@code if (x) {} } line looks like a method declaration to a
 * regular expression).
 */
public final class SummaryBuilder {

    private final String path;
    private final Language language;
    private final Set<String> keywords;
    private final List<Symbol> symbols = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();
    private final Set<String> seenTypes = new HashSet<>();
    private final Set<String> seenFunctions = new HashSet<>();
    private final Set<String> seenReferences = new HashSet<>();

    public SummaryBuilder(String path, Language language, Set<String> keywords) {
        this.path = path;
        this.language = language;
        this.keywords = keywords == null ? Set.of() : keywords;
    }

    /**
     * Adds a type symbol unless the name is blank or already present.
     *
     * @param name type name
     * @return this builder
     */
    public SummaryBuilder addType(String name) {
        String clean = clean(name);
        if (clean != null && seenTypes.add(clean)) {
            symbols.add(new Symbol(clean, SymbolKind.TYPE, path));
        }
        return this;
    }

    /**
     * Adds a function symbol unless the name is blank, a keyword, or already present.
     *
     * @param name function name
     * @return this builder
     */
    public SummaryBuilder addFunction(String name) {
        String clean = clean(name);
        if (clean != null && !keywords.contains(clean) && seenFunctions.add(clean)) {
            symbols.add(new Symbol(clean, SymbolKind.FUNCTION, path));
        }
        return this;
    }

    /**
     * Adds a raw reference unless the target is blank or already present.
     *
     * @param target reference token
     * @param kind syntactic origin
     * @param local whether the token was written as a same-project reference
     * @return this builder
     */
    public SummaryBuilder addReference(String target, ReferenceKind kind, boolean local) {
        String clean = clean(target);
        if (clean != null && seenReferences.add(clean)) {
            references.add(new Reference(path, clean, kind, local));
        }
        return this;
    }

    public FileSummary build() {
        return new FileSummary(path, language, symbols, references);
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
