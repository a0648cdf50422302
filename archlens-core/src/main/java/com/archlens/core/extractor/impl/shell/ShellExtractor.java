package com.archlens.core.extractor.impl.shell;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.SourceFile;

import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for shell scripts.
 *
 * <p>Function definitions in both the POSIX {@code name()} form and the
 * {@code function name} form are reported as functions. Scripts pulled in with
 * {@code source}, {@code .}, {@code bash}, {@code sh} or executed as {@code ./x.sh}
 * are same-project references.
 */
public class ShellExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "shell";
    private static final String EXTRACTOR_DISPLAY_NAME = "Shell Script Extractor";

    /**
     * Regex for function definitions: function deploy() { / deploy() {.
     * Captures: (1) name in the keyword form, (2) name in the POSIX form.
     */
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
        "^[ \\t]*(?:function[ \\t]+([A-Za-z_][\\w-]*)(?:[ \\t]*\\(\\))?|([A-Za-z_][\\w-]*)[ \\t]*\\(\\))[ \\t]*\\{?",
        Pattern.MULTILINE
    );

    /**
     * Regex for sourced or invoked scripts: source lib/env.sh / bash ./build.sh.
     * Captures: (1) script path.
     */
    private static final Pattern SOURCE_PATTERN = Pattern.compile(
        "(?:^|[;&|][ \\t]*|\\s)(?:source|\\.|bash|sh)[ \\t]+[\"']?([\\w./${}-]+\\.sh)[\"']?"
    );

    /**
     * Regex for direct execution: ./scripts/test.sh.
     * Captures: (1) script path.
     */
    private static final Pattern EXECUTE_PATTERN = Pattern.compile(
        "(?:^|[\\s;&|(\"'])(\\.\\.?/[\\w./-]+\\.sh)\\b"
    );

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
        return Set.of(Language.SHELL);
    }

    @Override
    protected Set<String> getKeywords() {
        return Set.of("if", "then", "for", "while", "until", "case", "select");
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        StringBuilder code = new StringBuilder();
        for (String line : file.content().split("\\R")) {
            if (!isComment(line)) {
                code.append(line).append('\n');
            }
        }
        String content = code.toString();

        for (MatchResult match : findMatches(FUNCTION_PATTERN, content)) {
            summary.addFunction(firstGroup(match, 1, 2));
        }

        for (MatchResult match : findMatches(SOURCE_PATTERN, content)) {
            addScriptReference(match.group(1), summary);
        }
        for (MatchResult match : findMatches(EXECUTE_PATTERN, content)) {
            addScriptReference(match.group(1), summary);
        }
    }

    private void addScriptReference(String script, SummaryBuilder summary) {
        if (script.contains("$")) {
            return;
        }
        summary.addReference(script, ReferenceKind.SCRIPT, true);
    }
}
