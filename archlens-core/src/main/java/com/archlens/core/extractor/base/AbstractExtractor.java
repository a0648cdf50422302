package com.archlens.core.extractor.base;

import com.archlens.core.extractor.SymbolExtractor;
import com.archlens.core.model.FileSummary;
import com.archlens.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Abstract base class for extractor implementations providing common functionality.
 *
 * <p>This class reduces code duplication across extractor implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>Language guard: files of an unsupported language yield an empty summary</li>
 *   <li>{@link SummaryBuilder} creation with the extractor's keyword denylist</li>
 * </ul>
 *
 * <p>Concrete extractors implement {@link #extractInto(SourceFile, SummaryBuilder)}
 * and may override {@link #getKeywords()}.
 *
 * @see SymbolExtractor
 * @see SummaryBuilder
 */
public abstract class AbstractExtractor implements SymbolExtractor {

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final FileSummary extract(SourceFile file) {
        if (!getSupportedLanguages().contains(file.language())) {
            log.debug("Skipping {}: language {} not handled by {}", file.path(), file.language(), getId());
            return emptySummary(file);
        }
        SummaryBuilder summary = new SummaryBuilder(file.path(), file.language(), getKeywords());
        extractInto(file, summary);
        FileSummary result = summary.build();
        log.debug("Extracted {} symbols and {} references from {}",
            result.symbols().size(), result.references().size(), file.path());
        return result;
    }

    /**
     * Performs the language-specific extraction.
     *
     * @param file source file
     * @param summary builder collecting the findings
     */
    protected abstract void extractInto(SourceFile file, SummaryBuilder summary);

    /**
     * Returns names never reported as functions for this language.
     *
     * @return keyword denylist, empty by default
     */
    protected Set<String> getKeywords() {
        return Set.of();
    }

    /**
     * Creates an empty summary for a file.
     *
     * @param file source file
     * @return summary without findings
     */
    protected FileSummary emptySummary(SourceFile file) {
        return new FileSummary(file.path(), file.language(), null, null);
    }
}
