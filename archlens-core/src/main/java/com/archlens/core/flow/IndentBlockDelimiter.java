package com.archlens.core.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Block delimiter for indentation-structured languages (Python).
 *
 * <p>Depth is the indentation column of a line, tabs counting as {@value #TAB_WIDTH}.
 * Any line indented at or left of a block's header closes that block. A header with
 * an inline body ({@code if ready: start()}) is split into the header and an indented
 * body line. Comment lines and triple-quoted string blocks are dropped.
 */
public class IndentBlockDelimiter implements BlockDelimiter {

    static final int TAB_WIDTH = 4;

    private static final Pattern INLINE_HEADER = Pattern.compile(
        "^(?:if|elif|else|while|for|try|except|finally|with)\\b.*"
    );

    @Override
    public List<String> logicalLines(List<String> physicalLines) {
        List<String> lines = new ArrayList<>();
        String openTripleQuote = null;

        for (String line : physicalLines) {
            String stripped = line.strip();
            if (openTripleQuote != null) {
                if (stripped.contains(openTripleQuote)) {
                    openTripleQuote = null;
                }
                continue;
            }
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            String tripleQuote = tripleQuoteOpenedBy(stripped);
            if (tripleQuote != null) {
                openTripleQuote = tripleQuote;
                continue;
            }
            if (isDocstringLine(stripped)) {
                continue;
            }
            splitInlineBody(line, stripped, lines);
        }
        return lines;
    }

    @Override
    public int depthOf(String line, int trackedDepth) {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column += TAB_WIDTH;
            } else {
                break;
            }
        }
        return column;
    }

    @Override
    public int trackedDepthAfter(String line, int trackedDepth) {
        return trackedDepth;
    }

    @Override
    public boolean closes(String line, int depth, BlockFrame frame) {
        return depth <= frame.openDepth();
    }

    @Override
    public String afterClose(String line) {
        return line;
    }

    @Override
    public int depthAfterClose(int depth) {
        return depth;
    }

    @Override
    public boolean opensBlock(String statement) {
        return statement.endsWith(":");
    }

    private void splitInlineBody(String line, String stripped, List<String> lines) {
        if (INLINE_HEADER.matcher(stripped).matches()) {
            int colon = topLevelColon(stripped);
            if (colon > 0 && colon < stripped.length() - 1) {
                String body = stripped.substring(colon + 1).strip();
                if (!body.isEmpty() && !body.startsWith("#")) {
                    String indent = line.substring(0, line.length() - line.stripLeading().length());
                    lines.add(indent + stripped.substring(0, colon + 1));
                    lines.add(indent + " ".repeat(TAB_WIDTH) + body);
                    return;
                }
            }
        }
        lines.add(line.stripTrailing());
    }

    /**
     * Finds the first colon outside brackets and string literals.
     */
    private static int topLevelColon(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                case ':' -> {
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> {
                    // other characters do not affect nesting
                }
            }
        }
        return -1;
    }

    private static String tripleQuoteOpenedBy(String stripped) {
        for (String quote : List.of("\"\"\"", "'''")) {
            int start = stripped.indexOf(quote);
            if (start >= 0 && stripped.indexOf(quote, start + 3) < 0) {
                return quote;
            }
        }
        return null;
    }

    private static boolean isDocstringLine(String stripped) {
        return (stripped.startsWith("\"\"\"") || stripped.startsWith("'''")) && stripped.length() >= 6;
    }
}
