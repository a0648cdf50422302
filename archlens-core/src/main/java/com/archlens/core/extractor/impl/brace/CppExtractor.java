package com.archlens.core.extractor.impl.brace;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.SourceFile;
import com.archlens.core.util.FileUtils;

import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for C and C++ sources and headers.
 *
 * <p><b>Recognized constructs:</b>
 * <ul>
 *   <li>Types: {@code class}, {@code struct}, {@code union}, {@code enum} and
 *       {@code enum class} definitions (forward declarations are ignored)</li>
 *   <li>Functions: definitions and prototypes with a return type, and qualified
 *       definitions such as {@code Engine::run(...)} or constructors</li>
 *   <li>References: {@code #include "local.h"} (same-project) and
 *       {@code #include <lib/header.h>} (external unless it is a standard header)</li>
 * </ul>
 *
 * <p>Angle-bracket includes of the C and C++ standard libraries are dropped. Other
 * angle-bracket includes are reported as external references named after their
 * first path segment, so {@code <boost/asio.hpp>} becomes {@code boost}.
 */
public class CppExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "cpp";
    private static final String EXTRACTOR_DISPLAY_NAME = "C/C++ Extractor";

    /**
     * Regex for type definitions: class Engine : public Base {.
     * Captures: (1) type name.
     */
    private static final Pattern TYPE_PATTERN = Pattern.compile(
        "\\b(?:enum\\s+class|enum\\s+struct|class|struct|union|enum)\\s+(?:alignas\\([^)]*\\)\\s*)?([A-Za-z_]\\w*(?:::\\w+)*)\\s*(?:final\\s*)?(?=[{:])"
    );

    /**
     * Regex for functions with a return type: static int parse(const char* s) {.
     * Captures: (1) last word before the name (return type or keyword), (2) function name.
     */
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
        "^[ \\t]*(?:[\\w:<>,]+[ \\t*&]+)*?([\\w:<>]+)[ \\t*&]+[*&]*([A-Za-z_~][\\w:~]*)[ \\t]*\\([^;{)]*\\)[ \\t]*(?:const[ \\t]*)?(?:noexcept[ \\t]*)?(?:override[ \\t]*)?(?:\\{|;|$)",
        Pattern.MULTILINE
    );

    /**
     * Regex for qualified definitions without a return type: Engine::Engine(int x) : a(x) {.
     * Captures: (1) qualified name.
     */
    private static final Pattern QUALIFIED_DEFINITION_PATTERN = Pattern.compile(
        "^[ \\t]*([A-Za-z_]\\w*::~?[A-Za-z_]\\w*)[ \\t]*\\([^;{)]*\\)[ \\t]*(?::|\\{|$)",
        Pattern.MULTILINE
    );

    /**
     * Regex for include directives.
     * Captures: (1) opening delimiter, (2) header path.
     */
    private static final Pattern INCLUDE_PATTERN = Pattern.compile(
        "^[ \\t]*#[ \\t]*include[ \\t]*([<\"])([^\">]+)[\">]",
        Pattern.MULTILINE
    );

    /**
     * Words that can precede a call and would otherwise be read as a return type.
     */
    private static final Set<String> NON_TYPE_WORDS = Set.of(
        "return", "else", "new", "delete", "throw", "case", "goto", "co_return", "co_await"
    );

    private static final Set<String> KEYWORDS = Set.of(
        "if", "while", "for", "switch", "return", "catch", "sizeof", "alignof", "decltype",
        "template", "using", "static_assert", "else", "do", "new", "delete", "throw", "case",
        "defined", "typeid"
    );

    private static final Set<String> STANDARD_HEADERS = Set.of(
        "algorithm", "array", "atomic", "bitset", "cassert", "cctype", "cerrno", "cfloat",
        "chrono", "climits", "cmath", "condition_variable", "cstdarg", "cstddef", "cstdint",
        "cstdio", "cstdlib", "cstring", "ctime", "deque", "exception", "filesystem", "fstream",
        "functional", "future", "initializer_list", "iomanip", "ios", "iosfwd", "iostream",
        "istream", "iterator", "limits", "list", "map", "memory", "mutex", "numeric",
        "optional", "ostream", "queue", "random", "ratio", "regex", "set", "sstream", "stack",
        "stdexcept", "streambuf", "string", "string_view", "system_error", "thread", "tuple",
        "type_traits", "typeinfo", "unordered_map", "unordered_set", "utility", "variant",
        "vector", "assert.h", "ctype.h", "errno.h", "float.h", "limits.h", "locale.h",
        "math.h", "setjmp.h", "signal.h", "stdarg.h", "stdbool.h", "stddef.h", "stdint.h",
        "stdio.h", "stdlib.h", "string.h", "time.h", "wchar.h", "unistd.h", "fcntl.h",
        "pthread.h", "sys", "windows.h"
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
        return Set.of(Language.CPP);
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
            String precedingWord = match.group(1);
            if (!NON_TYPE_WORDS.contains(precedingWord)) {
                summary.addFunction(match.group(2));
            }
        }
        for (MatchResult match : findMatches(QUALIFIED_DEFINITION_PATTERN, content)) {
            summary.addFunction(match.group(1));
        }

        for (MatchResult match : findMatches(INCLUDE_PATTERN, content)) {
            String header = match.group(2).trim();
            if ("\"".equals(match.group(1))) {
                summary.addReference(header, ReferenceKind.INCLUDE, true);
            } else {
                addSystemInclude(header, summary);
            }
        }
    }

    private void addSystemInclude(String header, SummaryBuilder summary) {
        String firstSegment = header.contains("/") ? header.substring(0, header.indexOf('/')) : header;
        if (STANDARD_HEADERS.contains(firstSegment)) {
            return;
        }
        summary.addReference(FileUtils.baseName(firstSegment), ReferenceKind.INCLUDE, false);
    }
}
