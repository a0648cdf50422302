package com.archlens.core.extractor.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for extractors that recognize declarations with regular expressions.
 *
 * <p>Provides:
 * <ul>
 *   <li>Match collection as immutable {@link MatchResult}s</li>
 *   <li>Group extraction tolerant of optional groups</li>
 *   <li>Quote cleaning and comment stripping utilities</li>
 * </ul>
 *
 * <p>Every extractor in this project extends this class. Lexical matching is
 * best-effort: a pattern that misses an unusual declaration loses that
 * symbol, it never fails the file.
 *
 * @see AbstractExtractor
 */
public abstract class AbstractRegexExtractor extends AbstractExtractor {

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("(?m)^\\s*//.*$");

    protected AbstractRegexExtractor() {
        super();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match results in order of occurrence
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Returns the first non-null group among the given indexes.
     *
     * <p>Useful for alternations where each branch captures into its own group.
     *
     * @param match match result
     * @param groups group indexes to try in order
     * @return first captured text, or null
     */
    protected String firstGroup(MatchResult match, int... groups) {
        for (int group : groups) {
            if (group <= match.groupCount() && match.group(group) != null) {
                return match.group(group);
            }
        }
        return null;
    }

    // ==================== String Utilities ====================

    /**
     * Trims whitespace and removes surrounding quotes or backticks.
     *
     * @param text text to clean
     * @return cleaned text, empty for null input
     */
    protected String cleanQuotes(String text) {
        if (text == null) {
            return "";
        }

        String trimmed = text.trim();

        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'') || (first == '`' && last == '`')) {
                return trimmed.substring(1, trimmed.length() - 1).trim();
            }
        }

        return trimmed;
    }

    /**
     * Removes C-style block comments and whole-line {@code //} comments.
     *
     * <p>Trailing {@code //} comments are kept so URLs inside string literals survive.
     *
     * @param content source text
     * @return text without comments
     */
    protected String stripCStyleComments(String content) {
        String withoutBlocks = BLOCK_COMMENT.matcher(content).replaceAll(" ");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }

    /**
     * Checks if a line is a comment in common programming languages.
     *
     * @param line line of code to check
     * @return true if line appears to be a comment
     */
    protected boolean isComment(String line) {
        if (line == null) {
            return false;
        }

        String trimmed = line.trim();
        return trimmed.startsWith("//")
            || trimmed.startsWith("#")
            || trimmed.startsWith("--")
            || trimmed.startsWith("/*")
            || trimmed.startsWith("*");
    }
}
