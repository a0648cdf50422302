package com.archlens.core.flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Block delimiter for C-family languages where braces bound blocks.
 *
 * <p>Logical lines are produced by a small character scanner that drops comments,
 * keeps string literals intact and breaks after every opening brace, after every
 * semicolon outside parentheses and around every closing brace. A closing brace
 * stays on the line of a following {@code else}, {@code catch}, {@code finally} or
 * {@code while}, so the single line
 * <pre>
 * if (x) &#123; a(); &#125; else &#123; b(); &#125;
 * </pre>
 * becomes five logical lines: the if header, {@code a();}, the else header,
 * {@code b();} and the final closing brace.
 *
 * <p>Depth is the running brace depth. A line starting with a closing brace closes
 * the innermost block when the depth does not exceed the block's opening depth plus
 * one, so the braces of object literals and function bodies never close a control
 * block.
 */
public class BraceBlockDelimiter implements BlockDelimiter {

    private static final Pattern CLOSE_CONTINUATION = Pattern.compile("^(?:else|catch|finally|while)\\b");

    private final boolean singleQuoteStrings;

    /**
     * Creates a delimiter.
     *
     * @param singleQuoteStrings true when {@code '} opens string literals (JavaScript, C);
     *                           false when it may start a lifetime (Rust)
     */
    public BraceBlockDelimiter(boolean singleQuoteStrings) {
        this.singleQuoteStrings = singleQuoteStrings;
    }

    @Override
    public List<String> logicalLines(List<String> physicalLines) {
        String source = String.join("\n", physicalLines);
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        Deque<Integer> enclosingParens = new ArrayDeque<>();
        int parenDepth = 0;
        int i = 0;

        while (i < source.length()) {
            char c = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';

            if (c == '/' && next == '/') {
                i = skipLineComment(source, i);
                continue;
            }
            if (c == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                i = end < 0 ? source.length() : end + 2;
                current.append(' ');
                continue;
            }
            if (c == '"' || c == '`' || (c == '\'' && isStringQuote(source, i))) {
                int end = endOfString(source, i);
                current.append(source, i, end);
                i = end;
                continue;
            }

            switch (c) {
                case '(' -> {
                    parenDepth++;
                    current.append(c);
                }
                case ')' -> {
                    parenDepth = Math.max(0, parenDepth - 1);
                    current.append(c);
                }
                case '{' -> {
                    current.append(c);
                    emit(lines, current);
                    enclosingParens.push(parenDepth);
                    parenDepth = 0;
                }
                case ';' -> {
                    current.append(c);
                    if (parenDepth == 0) {
                        emit(lines, current);
                    }
                }
                case '}' -> {
                    emit(lines, current);
                    parenDepth = enclosingParens.isEmpty() ? 0 : enclosingParens.pop();
                    current.append('}');
                    int lookahead = skipWhitespace(source, i + 1);
                    if (CLOSE_CONTINUATION.matcher(source.substring(lookahead, Math.min(source.length(), lookahead + 8))).find()) {
                        current.append(' ');
                        i = lookahead;
                        continue;
                    }
                    emit(lines, current);
                }
                case '\n' -> emit(lines, current);
                default -> current.append(c);
            }
            i++;
        }
        emit(lines, current);
        return lines;
    }

    @Override
    public int depthOf(String line, int trackedDepth) {
        return trackedDepth;
    }

    @Override
    public int trackedDepthAfter(String line, int trackedDepth) {
        int depth = trackedDepth;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"' || c == '`' || (c == '\'' && isStringQuote(line, i))) {
                i = endOfString(line, i);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
            i++;
        }
        return depth;
    }

    @Override
    public boolean closes(String line, int depth, BlockFrame frame) {
        return line.startsWith("}") && depth <= frame.openDepth() + 1;
    }

    @Override
    public String afterClose(String line) {
        return line.startsWith("}") ? line.substring(1).strip() : line;
    }

    @Override
    public int depthAfterClose(int depth) {
        return Math.max(0, depth - 1);
    }

    @Override
    public boolean opensBlock(String statement) {
        return statement.endsWith("{");
    }

    private boolean isStringQuote(String source, int index) {
        if (singleQuoteStrings) {
            return true;
        }
        // Character literal: 'a' or '\n'; anything else is a lifetime such as 'a or 'static.
        if (index + 2 < source.length() && source.charAt(index + 1) != '\\') {
            return source.charAt(index + 2) == '\'';
        }
        return index + 1 < source.length() && source.charAt(index + 1) == '\\';
    }

    private static int endOfString(String source, int start) {
        char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n' && quote != '`') {
                return i;
            }
            i++;
        }
        return source.length();
    }

    private static int skipLineComment(String source, int start) {
        int end = source.indexOf('\n', start);
        return end < 0 ? source.length() : end;
    }

    private static int skipWhitespace(String source, int start) {
        int i = start;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i;
    }

    private static void emit(List<String> lines, StringBuilder current) {
        String line = current.toString().strip();
        if (!line.isEmpty()) {
            lines.add(line);
        }
        current.setLength(0);
    }
}
