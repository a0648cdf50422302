package com.archlens.core.extractor;

import com.archlens.core.model.FileSummary;
import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Dispatches files to the extractor that supports their language.
 *
 * <p>Extractors are discovered with {@link ServiceLoader}. When several extractors
 * claim the same language, the one with the highest {@link SymbolExtractor#getPriority()}
 * wins, ties broken by id.
 */
public class ExtractorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);

    private final List<SymbolExtractor> extractors;
    private final Map<Language, SymbolExtractor> byLanguage = new EnumMap<>(Language.class);

    /**
     * Creates a registry over the given extractors.
     *
     * @param extractors extractors to dispatch to
     */
    public ExtractorRegistry(List<SymbolExtractor> extractors) {
        Objects.requireNonNull(extractors, "extractors must not be null");
        List<SymbolExtractor> sorted = new ArrayList<>(extractors);
        sorted.sort(Comparator.comparingInt(SymbolExtractor::getPriority).reversed()
            .thenComparing(SymbolExtractor::getId));
        this.extractors = List.copyOf(sorted);

        for (SymbolExtractor extractor : this.extractors) {
            for (Language language : extractor.getSupportedLanguages()) {
                byLanguage.putIfAbsent(language, extractor);
            }
        }
    }

    /**
     * Creates a registry of every extractor registered on the classpath.
     *
     * @return registry backed by {@link ServiceLoader}
     */
    public static ExtractorRegistry loadDefault() {
        List<SymbolExtractor> discovered = new ArrayList<>();
        ServiceLoader.load(SymbolExtractor.class).forEach(discovered::add);
        log.debug("Discovered {} extractors", discovered.size());
        return new ExtractorRegistry(discovered);
    }

    /**
     * Returns all extractors, highest priority first.
     *
     * @return registered extractors
     */
    public List<SymbolExtractor> getExtractors() {
        return extractors;
    }

    /**
     * Finds the extractor responsible for a language.
     *
     * @param language language
     * @return extractor, empty when the language is not supported
     */
    public Optional<SymbolExtractor> findExtractor(Language language) {
        return Optional.ofNullable(byLanguage.get(language));
    }

    /**
     * Extracts a file with the extractor for its language.
     *
     * @param file source file
     * @return summary, empty when no extractor supports the file's language
     */
    public FileSummary extract(SourceFile file) {
        return findExtractor(file.language())
            .map(extractor -> extractor.extract(file))
            .orElseGet(() -> new FileSummary(file.path(), file.language(), null, null));
    }
}
