package com.archlens.core.extractor.impl.declarative;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.SourceFile;

import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for JSON, YAML and TOML configuration files.
 *
 * <p>Configuration files declare no symbols. Values of the keys {@code extends},
 * {@code import}, {@code include}, {@code using} and {@code source} are reported
 * as references, whether the value is a scalar or a JSON array of strings.
 * Values starting with {@code .} or {@code /} are same-project references.
 */
public class ConfigExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "config";
    private static final String EXTRACTOR_DISPLAY_NAME = "Configuration File Extractor";
    private static final String KEYS = "(?:extends|import|imports|include|includes|using|source)";

    /**
     * Regex for JSON string values: "extends": "./tsconfig.base.json".
     * Captures: (1) referenced value.
     */
    private static final Pattern JSON_SCALAR_PATTERN = Pattern.compile(
        "\"" + KEYS + "\"\\s*:\\s*\"([^\"]+)\""
    );

    /**
     * Regex for JSON array values: "extends": ["a", "b"].
     * Captures: (1) array body.
     */
    private static final Pattern JSON_ARRAY_PATTERN = Pattern.compile(
        "\"" + KEYS + "\"\\s*:\\s*\\[([^\\]]*)\\]"
    );

    /**
     * Regex for YAML scalar values: include: shared/base.yml.
     * Captures: (1) referenced value, quotes included.
     */
    private static final Pattern YAML_PATTERN = Pattern.compile(
        "^[ \\t-]*" + KEYS + "[ \\t]*:[ \\t]*([^\\s#\\[{][^#\\n]*)",
        Pattern.MULTILINE
    );

    /**
     * Regex for TOML values: include = "common.toml".
     * Captures: (1) referenced value.
     */
    private static final Pattern TOML_PATTERN = Pattern.compile(
        "^[ \\t]*" + KEYS + "[ \\t]*=[ \\t]*[\"']([^\"']+)[\"']",
        Pattern.MULTILINE
    );

    private static final Pattern QUOTED_VALUE = Pattern.compile("\"([^\"]+)\"");

    @Override
    public String getId() {
        return EXTRACTOR_ID;
    }

    @Override
    public String getDisplayName() {
        return EXTRACTOR_DISPLAY_NAME;
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.CONFIG);
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        String content = file.content();

        for (MatchResult match : findMatches(JSON_SCALAR_PATTERN, content)) {
            addConfigReference(match.group(1), summary);
        }
        for (MatchResult match : findMatches(JSON_ARRAY_PATTERN, content)) {
            for (MatchResult value : findMatches(QUOTED_VALUE, match.group(1))) {
                addConfigReference(value.group(1), summary);
            }
        }
        for (MatchResult match : findMatches(YAML_PATTERN, content)) {
            addConfigReference(match.group(1), summary);
        }
        for (MatchResult match : findMatches(TOML_PATTERN, content)) {
            addConfigReference(match.group(1), summary);
        }
    }

    private void addConfigReference(String rawValue, SummaryBuilder summary) {
        String value = cleanQuotes(rawValue);
        if (value.isEmpty() || value.contains("://")) {
            return;
        }
        boolean local = value.startsWith(".") || value.startsWith("/");
        summary.addReference(value, ReferenceKind.CONFIG, local);
    }
}
