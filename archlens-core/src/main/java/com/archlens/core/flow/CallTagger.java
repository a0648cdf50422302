package com.archlens.core.flow;

import com.archlens.core.model.StepTag;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes call- and assignment-shaped statements and tags them by the name called.
 *
 * <p>Tagging looks at the segments of a dotted call name ({@code this.db.query}):
 * <ul>
 *   <li>{@link StepTag#LOG}: print functions and calls on console/logger objects,
 *       labeled {@code Log: <name>}</li>
 *   <li>{@link StepTag#API_CALL}: fetch, axios, request, http, get, post and similar</li>
 *   <li>{@link StepTag#DB_QUERY}: query, execute, save, insert, select, find and similar</li>
 * </ul>
 * A segment also matches when it starts with one of the verbs followed by an
 * upper-case letter ({@code findById}, {@code fetchUsers}).
 */
final class CallTagger {

    private static final Pattern CALL = Pattern.compile(
        "([A-Za-z_$][\\w$]*(?:\\s*(?:\\.|::|->|\\?\\.)\\s*[A-Za-z_$][\\w$]*)*)\\s*!?\\s*(?:<[^<>()]*>)?\\s*\\("
    );

    private static final Pattern ASSIGNMENT = Pattern.compile(
        "^(?:(?:let|const|var|val|mut|auto|final|static|int|long|float|double|char|bool|boolean|string|size_t)\\s+)*([A-Za-z_$][\\w$.]*)\\s*(?::[^=]+)?(?:[+\\-*/%|&^]|<<|>>)?=(?![=>])"
    );

    private static final Pattern DECLARATION = Pattern.compile(
        "^(?:export\\s+)?(?:default\\s+)?(?:pub(?:\\([^)]*\\))?\\s+)?(?:async\\s+)?(?:def|class|function|fn|impl|struct|enum|interface|trait|type|import|from|use|mod|package|namespace|template|typedef|extern|return)\\b"
    );

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\s*(?:\\.|::|->|\\?\\.)\\s*");

    private static final Set<String> NOT_CALLS = Set.of(
        "if", "elif", "for", "while", "switch", "match", "catch", "return", "function", "typeof",
        "sizeof", "super", "not", "and", "or", "in", "lambda", "assert", "del", "yield", "await",
        "new", "throw", "raise", "with"
    );

    private static final Set<String> LOG_FUNCTIONS = Set.of(
        "print", "println", "printf", "eprintln", "puts", "echo", "cout"
    );
    private static final Set<String> LOG_RECEIVERS = Set.of("console", "logger", "log", "logging");

    private static final Set<String> API_WORDS = Set.of(
        "fetch", "axios", "request", "requests", "http", "https", "get", "post", "put", "patch", "urlopen"
    );
    private static final Set<String> API_PREFIXES = Set.of("fetch", "request");

    private static final Set<String> DB_WORDS = Set.of(
        "query", "execute", "executemany", "save", "insert", "select", "find", "update", "delete", "commit"
    );
    private static final Set<String> DB_PREFIXES = Set.of("query", "execute", "save", "insert", "select", "find");

    private CallTagger() {
        // Utility class
    }

    /**
     * A recognized statement.
     *
     * @param label step label
     * @param tag semantic tag
     */
    record TaggedStatement(String label, StepTag tag) {}

    /**
     * Classifies a statement.
     *
     * @param statement stripped statement text
     * @return tagged statement, empty when the line is neither call- nor assignment-shaped
     */
    static Optional<TaggedStatement> classify(String statement) {
        if (statement.isEmpty() || statement.startsWith("#") || DECLARATION.matcher(statement).find()
            && !statement.startsWith("return ")) {
            return Optional.empty();
        }

        Optional<String> call = findCallName(statement);
        if (call.isPresent()) {
            return Optional.of(tag(call.get()));
        }

        Matcher assignment = ASSIGNMENT.matcher(statement);
        if (assignment.find()) {
            return Optional.of(new TaggedStatement(assignment.group(1), StepTag.NONE));
        }
        return Optional.empty();
    }

    private static Optional<String> findCallName(String statement) {
        Matcher matcher = CALL.matcher(statement);
        while (matcher.find()) {
            String name = SEGMENT_SEPARATOR.matcher(matcher.group(1)).replaceAll(".");
            List<String> segments = segmentsOf(name);
            String last = segments.get(segments.size() - 1);
            if (!NOT_CALLS.contains(last) && !NOT_CALLS.contains(segments.get(0))) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    static TaggedStatement tag(String callName) {
        List<String> segments = segmentsOf(callName);
        String first = segments.get(0).toLowerCase(Locale.ROOT);
        String last = segments.get(segments.size() - 1);

        if (LOG_FUNCTIONS.contains(last.toLowerCase(Locale.ROOT)) || LOG_RECEIVERS.contains(first)
            || callName.startsWith("System.out") || callName.startsWith("System.err")) {
            return new TaggedStatement("Log: " + callName, StepTag.LOG);
        }
        if (segments.stream().anyMatch(segment -> matchesWord(segment, API_WORDS, API_PREFIXES))) {
            return new TaggedStatement(callName, StepTag.API_CALL);
        }
        if (segments.stream().anyMatch(segment -> matchesWord(segment, DB_WORDS, DB_PREFIXES))) {
            return new TaggedStatement(callName, StepTag.DB_QUERY);
        }
        return new TaggedStatement(callName, StepTag.NONE);
    }

    private static boolean matchesWord(String segment, Set<String> words, Set<String> prefixes) {
        String lower = segment.toLowerCase(Locale.ROOT);
        if (words.contains(lower)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (segment.length() > prefix.length()
                && segment.startsWith(prefix)
                && (Character.isUpperCase(segment.charAt(prefix.length())) || segment.charAt(prefix.length()) == '_')) {
                return true;
            }
        }
        return false;
    }

    private static List<String> segmentsOf(String name) {
        return Arrays.asList(name.split("\\."));
    }
}
