package com.archlens.core.extractor;

import com.archlens.core.model.FileSummary;
import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;

import java.util.Set;

/**
 * Interface for lexical extractors that pull declared symbols and raw references
 * out of a single source file.
 *
 * <p>Extractors are discovered via Java Service Provider Interface (SPI) and selected
 * by the language of the file being scanned. Extraction is deliberately lexical:
 * implementations match declarations and reference statements with regular
 * expressions rather than building a syntax tree.
 *
 * <p>Implementations must be stateless and must never throw on malformed content;
 * a file that cannot be understood yields a partial or empty {@link FileSummary}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.archlens.core.extractor.SymbolExtractor}
 *
 * @see ExtractorRegistry
 */
public interface SymbolExtractor {

    /**
     * Returns unique identifier for this extractor.
     *
     * <p>Should be kebab-case (e.g., "javascript-typescript", "python").
     *
     * @return unique extractor identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this extractor.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the languages this extractor understands.
     *
     * @return supported languages
     */
    Set<Language> getSupportedLanguages();

    /**
     * Returns selection priority when several extractors support the same language.
     *
     * <p>Higher values win. Built-in extractors use 100.
     *
     * @return priority value
     */
    default int getPriority() {
        return 100;
    }

    /**
     * Extracts symbols and references from a file.
     *
     * @param file source file with content
     * @return summary of declared symbols and raw references, never null
     */
    FileSummary extract(SourceFile file);
}
