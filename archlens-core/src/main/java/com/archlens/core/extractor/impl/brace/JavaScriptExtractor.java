package com.archlens.core.extractor.impl.brace;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.SourceFile;

import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for JavaScript and TypeScript modules.
 *
 * <p><b>Recognized constructs:</b>
 * <ul>
 *   <li>Types: {@code class}, {@code interface}, {@code enum} (with optional
 *       {@code export}, {@code default}, {@code abstract} and {@code declare} prefixes)</li>
 *   <li>Functions: {@code function name()}, generator and {@code async} functions,
 *       arrow functions bound to {@code const}/{@code let}/{@code var}, and class methods
 *       with or without access modifiers</li>
 *   <li>References: static {@code import ... from 'x'}, side-effect {@code import 'x'},
 *       {@code export ... from 'x'}, {@code require('x')} and dynamic {@code import('x')}</li>
 * </ul>
 *
 * <p>Specifiers starting with {@code .} or {@code /} are same-project references and
 * are kept as written. Bare specifiers name packages: Node built-ins are dropped and
 * other packages are reduced to their package name ({@code lodash/fp} becomes
 * {@code lodash}, scoped packages keep {@code @scope/name}).
 */
public class JavaScriptExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "javascript-typescript";
    private static final String EXTRACTOR_DISPLAY_NAME = "JavaScript/TypeScript Extractor";
    private static final String NODE_SCHEME = "node:";

    /**
     * Regex for type declarations.
     * Captures: (1) type name.
     */
    private static final Pattern TYPE_PATTERN = Pattern.compile(
        "^[ \\t]*(?:export[ \\t]+)?(?:default[ \\t]+)?(?:declare[ \\t]+)?(?:abstract[ \\t]+)?(?:const[ \\t]+)?(?:class|interface|enum)[ \\t]+([A-Za-z_$][\\w$]*)",
        Pattern.MULTILINE
    );

    /**
     * Regex for function declarations: export async function* load(.
     * Captures: (1) function name.
     */
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
        "\\b(?:async[ \\t]+)?function[ \\t]*\\*?[ \\t]*([A-Za-z_$][\\w$]*)[ \\t]*(?:<[^>]*>)?[ \\t]*\\("
    );

    /**
     * Regex for arrow functions bound to a variable: const load = async (a, b) =>.
     * Captures: (1) variable name.
     */
    private static final Pattern ARROW_FUNCTION_PATTERN = Pattern.compile(
        "\\b(?:const|let|var)[ \\t]+([A-Za-z_$][\\w$]*)[ \\t]*(?::[^=]+)?=[ \\t]*(?:async[ \\t]+)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)[ \\t]*(?::[^=]+)?=>"
    );

    /**
     * Regex for class methods: private async handle(event: Event): Promise<void> {.
     * Captures: (1) method name.
     */
    private static final Pattern METHOD_PATTERN = Pattern.compile(
        "^[ \\t]+(?:(?:public|private|protected|static|readonly|override|abstract|async|get|set)[ \\t]+)*\\*?([A-Za-z_$][\\w$]*)[ \\t]*(?:<[^>]*>)?[ \\t]*\\([^)]*\\)[ \\t]*(?::[^{;=]+)?\\{",
        Pattern.MULTILINE
    );

    /**
     * Regex for static imports and re-exports: import x from './y' / export * from './y'.
     * Captures: (1) module specifier.
     */
    private static final Pattern IMPORT_FROM_PATTERN = Pattern.compile(
        "^[ \\t]*(?:import|export)[ \\t]+(?:type[ \\t]+)?[^'\";]*?[ \\t]from[ \\t]*['\"]([^'\"]+)['\"]",
        Pattern.MULTILINE
    );

    /**
     * Regex for side-effect imports: import './polyfills'.
     * Captures: (1) module specifier.
     */
    private static final Pattern SIDE_EFFECT_IMPORT_PATTERN = Pattern.compile(
        "^[ \\t]*import[ \\t]*['\"]([^'\"]+)['\"]",
        Pattern.MULTILINE
    );

    /**
     * Regex for require calls.
     * Captures: (1) module specifier.
     */
    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
        "\\brequire[ \\t]*\\([ \\t]*['\"]([^'\"]+)['\"][ \\t]*\\)"
    );

    /**
     * Regex for dynamic imports.
     * Captures: (1) module specifier.
     */
    private static final Pattern DYNAMIC_IMPORT_PATTERN = Pattern.compile(
        "\\bimport[ \\t]*\\([ \\t]*['\"]([^'\"]+)['\"][ \\t]*\\)"
    );

    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "return", "function", "new", "typeof",
        "await", "super", "with", "do", "else", "try", "constructor", "import", "require"
    );

    private static final Set<String> NODE_BUILTINS = Set.of(
        "assert", "async_hooks", "buffer", "child_process", "cluster", "console", "crypto",
        "dgram", "dns", "events", "fs", "http", "http2", "https", "inspector", "module", "net",
        "os", "path", "perf_hooks", "process", "querystring", "readline", "repl", "stream",
        "string_decoder", "timers", "tls", "tty", "url", "util", "v8", "vm", "worker_threads",
        "zlib"
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
        return Set.of(Language.JAVASCRIPT, Language.TYPESCRIPT);
    }

    @Override
    protected Set<String> getKeywords() {
        return KEYWORDS;
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        String content = stripCStyleComments(file.content());

        for (MatchResult match : findMatches(TYPE_PATTERN, content)) {
            summary.addType(match.group(1));
        }

        for (MatchResult match : findMatches(FUNCTION_PATTERN, content)) {
            summary.addFunction(match.group(1));
        }
        for (MatchResult match : findMatches(ARROW_FUNCTION_PATTERN, content)) {
            summary.addFunction(match.group(1));
        }
        for (MatchResult match : findMatches(METHOD_PATTERN, content)) {
            summary.addFunction(match.group(1));
        }

        for (MatchResult match : findMatches(IMPORT_FROM_PATTERN, content)) {
            addModuleReference(match.group(1), ReferenceKind.IMPORT, summary);
        }
        for (MatchResult match : findMatches(SIDE_EFFECT_IMPORT_PATTERN, content)) {
            addModuleReference(match.group(1), ReferenceKind.IMPORT, summary);
        }
        for (MatchResult match : findMatches(REQUIRE_PATTERN, content)) {
            addModuleReference(match.group(1), ReferenceKind.REQUIRE, summary);
        }
        for (MatchResult match : findMatches(DYNAMIC_IMPORT_PATTERN, content)) {
            addModuleReference(match.group(1), ReferenceKind.IMPORT, summary);
        }
    }

    private void addModuleReference(String specifier, ReferenceKind kind, SummaryBuilder summary) {
        String token = cleanQuotes(specifier);
        if (token.startsWith(".") || token.startsWith("/")) {
            summary.addReference(token, kind, true);
            return;
        }
        if (token.startsWith(NODE_SCHEME)) {
            return;
        }
        String packageName = packageNameOf(token);
        if (!NODE_BUILTINS.contains(packageName)) {
            summary.addReference(packageName, kind, false);
        }
    }

    private static String packageNameOf(String specifier) {
        String[] segments = specifier.split("/");
        if (specifier.startsWith("@") && segments.length >= 2) {
            return segments[0] + "/" + segments[1];
        }
        return segments[0];
    }
}
