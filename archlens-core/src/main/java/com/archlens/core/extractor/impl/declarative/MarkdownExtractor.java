package com.archlens.core.extractor.impl.declarative;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.SourceFile;

import java.util.Locale;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for Markdown documents.
 *
 * <p>ATX headers ({@code # Title} to {@code ###### Title}) are reported as type
 * symbols. Inline links (not images) whose target is neither a URL, a mail address
 * nor a same-page anchor are reported as same-project references, with any
 * {@code #fragment} removed. Fenced code blocks are skipped.
 */
public class MarkdownExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "markdown";
    private static final String EXTRACTOR_DISPLAY_NAME = "Markdown Extractor";

    /**
     * Regex for ATX headers.
     * Captures: (1) header text without closing hashes.
     */
    private static final Pattern HEADER_PATTERN = Pattern.compile(
        "^[ ]{0,3}#{1,6}[ \\t]+(.+?)(?:[ \\t]+#+)?[ \\t]*$",
        Pattern.MULTILINE
    );

    /**
     * Regex for inline links: [text](target "title"), images excluded.
     * Captures: (1) link target.
     */
    private static final Pattern LINK_PATTERN = Pattern.compile(
        "(?<!!)\\[[^\\]]*\\]\\(\\s*<?([^)\\s>]+)>?(?:\\s+[\"'][^\"']*[\"'])?\\s*\\)"
    );

    private static final Pattern FENCED_CODE = Pattern.compile(
        "^[ ]{0,3}(```|~~~).*?^[ ]{0,3}\\1[ \\t]*$",
        Pattern.MULTILINE | Pattern.DOTALL
    );

    private static final Set<String> EXTERNAL_SCHEMES = Set.of("http:", "https:", "mailto:", "ftp:", "data:");

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
        return Set.of(Language.MARKDOWN);
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        String content = FENCED_CODE.matcher(file.content()).replaceAll("");

        for (MatchResult match : findMatches(HEADER_PATTERN, content)) {
            summary.addType(match.group(1));
        }

        for (MatchResult match : findMatches(LINK_PATTERN, content)) {
            String target = match.group(1);
            if (isExternal(target)) {
                continue;
            }
            int fragment = target.indexOf('#');
            String path = fragment >= 0 ? target.substring(0, fragment) : target;
            summary.addReference(path, ReferenceKind.LINK, true);
        }
    }

    private static boolean isExternal(String target) {
        if (target.startsWith("#")) {
            return true;
        }
        String lower = target.toLowerCase(Locale.ROOT);
        return EXTERNAL_SCHEMES.stream().anyMatch(lower::startsWith);
    }
}
