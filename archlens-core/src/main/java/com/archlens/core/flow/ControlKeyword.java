package com.archlens.core.flow;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Control keywords recognized as block headers.
 *
 * <p>{@code while} is a decision: it either enters the body ({@code next}) or leaves
 * the loop ({@code alternateNext}). {@code for} and {@code loop} headers are process
 * steps; the reconstructor gives their blocks a hidden exit decision instead.
 */
public enum ControlKeyword {
    IF(true, false, false, true),
    ELIF(true, false, true, false),
    ELSE(false, false, true, false),
    WHILE(true, true, false, false),
    FOR(false, true, false, false),
    LOOP(false, true, false, false),
    MATCH(true, false, false, true),
    TRY(false, false, false, false),
    CATCH(false, false, true, false);

    private static final Pattern HEADER = Pattern.compile(
        "^(else\\s+if|elif|if|else|while|for|loop|match|switch|try|catch|except|finally)\\b\\s*(.*)$"
    );

    private final boolean decision;
    private final boolean loop;
    private final boolean continuation;
    private final boolean allocatesJoin;

    ControlKeyword(boolean decision, boolean loop, boolean continuation, boolean allocatesJoin) {
        this.decision = decision;
        this.loop = loop;
        this.continuation = continuation;
        this.allocatesJoin = allocatesJoin;
    }

    public boolean isDecision() {
        return decision;
    }

    public boolean isLoop() {
        return loop;
    }

    /**
     * Returns true for keywords that continue a preceding block (else, elif, catch).
     *
     * @return true for continuation keywords
     */
    public boolean isContinuation() {
        return continuation;
    }

    public boolean allocatesJoin() {
        return allocatesJoin;
    }

    /**
     * Parses a statement as a block header.
     *
     * @param statement stripped statement text
     * @return header, empty when the statement does not start with a control keyword
     */
    public static Optional<Header> parse(String statement) {
        Matcher matcher = HEADER.matcher(statement);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String word = matcher.group(1).replaceAll("\\s+", " ");
        ControlKeyword keyword = switch (word) {
            case "else if", "elif" -> ELIF;
            case "if" -> IF;
            case "else" -> ELSE;
            case "while" -> WHILE;
            case "for" -> FOR;
            case "loop" -> LOOP;
            case "match", "switch" -> MATCH;
            case "try" -> TRY;
            default -> CATCH;
        };
        return Optional.of(new Header(keyword, word, conditionOf(matcher.group(2))));
    }

    private static String conditionOf(String rest) {
        String condition = rest.strip();
        while (condition.endsWith("{") || condition.endsWith(":")) {
            condition = condition.substring(0, condition.length() - 1).strip();
        }
        if (condition.startsWith("(") && condition.endsWith(")") && wrapsWhole(condition)) {
            condition = condition.substring(1, condition.length() - 1).strip();
        }
        return condition;
    }

    private static boolean wrapsWhole(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * A parsed block header.
     *
     * @param keyword recognized keyword
     * @param word keyword as written, whitespace collapsed
     * @param condition header text after the keyword without delimiters or wrapping parentheses
     */
    public record Header(ControlKeyword keyword, String word, String condition) {

        public String label() {
            return condition.isEmpty() ? word : word + " " + condition;
        }

        @Override
        public String toString() {
            return keyword.name().toLowerCase(Locale.ROOT) + ":" + label();
        }
    }
}
