package com.archlens.core.extractor.impl.indent;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.ReferenceKind;
import com.archlens.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for Python modules.
 *
 * <p><b>Recognized constructs:</b>
 * <ul>
 *   <li>Types: {@code class Name:} and {@code class Name(Base):} at any indentation</li>
 *   <li>Functions: {@code def} and {@code async def}</li>
 *   <li>References: {@code import a, b.c as d} and {@code from x import y}, including
 *       parenthesized multi-line name lists</li>
 * </ul>
 *
 * <p>Relative imports are rewritten to relative paths so they resolve against the
 * importing file's directory: {@code from .utils import x} becomes {@code ./utils},
 * {@code from ..core.graph import y} becomes {@code ../core/graph} and
 * {@code from . import helpers} becomes {@code ./helpers}. Absolute imports keep their
 * dotted module name. Standard library modules are dropped.
 */
public class PythonExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "python";
    private static final String EXTRACTOR_DISPLAY_NAME = "Python Extractor";

    /**
     * Regex for class declarations.
     * Captures: (1) class name.
     */
    private static final Pattern CLASS_PATTERN = Pattern.compile(
        "^[ \\t]*class[ \\t]+([A-Za-z_]\\w*)[ \\t]*[(:]",
        Pattern.MULTILINE
    );

    /**
     * Regex for function declarations.
     * Captures: (1) function name.
     */
    private static final Pattern DEF_PATTERN = Pattern.compile(
        "^[ \\t]*(?:async[ \\t]+)?def[ \\t]+([A-Za-z_]\\w*)[ \\t]*\\(",
        Pattern.MULTILINE
    );

    /**
     * Regex for plain imports: import os, pkg.mod as m.
     * Captures: (1) comma-separated module list.
     */
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
        "^[ \\t]*import[ \\t]+([\\w.]+(?:[ \\t]+as[ \\t]+\\w+)?(?:[ \\t]*,[ \\t]*[\\w.]+(?:[ \\t]+as[ \\t]+\\w+)?)*)",
        Pattern.MULTILINE
    );

    /**
     * Regex for from-imports: from .pkg import (a, b).
     * Captures: (1) module (possibly only dots), (2) imported names.
     */
    private static final Pattern FROM_IMPORT_PATTERN = Pattern.compile(
        "^[ \\t]*from[ \\t]+(\\.+[\\w.]*|[\\w.]+)[ \\t]+import[ \\t]+(\\([^)]*\\)|[^\\n#]+)",
        Pattern.MULTILINE
    );

    private static final Pattern ALIAS_PATTERN = Pattern.compile("\\s+as\\s+\\w+");

    private static final Set<String> STANDARD_MODULES = Set.of(
        "__future__", "abc", "argparse", "array", "ast", "asyncio", "base64", "bisect",
        "builtins", "collections", "concurrent", "configparser", "contextlib", "copy", "csv",
        "ctypes", "dataclasses", "datetime", "decimal", "enum", "errno", "fnmatch", "functools",
        "gc", "getpass", "glob", "gzip", "hashlib", "heapq", "hmac", "html", "http", "importlib",
        "inspect", "io", "itertools", "json", "logging", "math", "multiprocessing", "operator",
        "os", "pathlib", "pickle", "platform", "pprint", "queue", "random", "re", "secrets",
        "select", "shlex", "shutil", "signal", "socket", "sqlite3", "ssl", "stat", "statistics",
        "string", "struct", "subprocess", "sys", "tempfile", "textwrap", "threading", "time",
        "timeit", "traceback", "types", "typing", "unittest", "urllib", "uuid", "warnings",
        "weakref", "xml", "zipfile", "zlib"
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
        return Set.of(Language.PYTHON);
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        String content = file.content();

        for (MatchResult match : findMatches(CLASS_PATTERN, content)) {
            summary.addType(match.group(1));
        }
        for (MatchResult match : findMatches(DEF_PATTERN, content)) {
            summary.addFunction(match.group(1));
        }

        for (MatchResult match : findMatches(IMPORT_PATTERN, content)) {
            for (String module : splitNames(match.group(1))) {
                addAbsoluteReference(module, summary);
            }
        }

        for (MatchResult match : findMatches(FROM_IMPORT_PATTERN, content)) {
            String module = match.group(1);
            if (!module.startsWith(".")) {
                addAbsoluteReference(module, summary);
                continue;
            }
            int dots = countLeadingDots(module);
            String remainder = module.substring(dots);
            if (!remainder.isEmpty()) {
                summary.addReference(relativePrefix(dots) + remainder.replace('.', '/'), ReferenceKind.IMPORT, true);
            } else {
                for (String name : splitNames(match.group(2))) {
                    summary.addReference(relativePrefix(dots) + name, ReferenceKind.IMPORT, true);
                }
            }
        }
    }

    private void addAbsoluteReference(String module, SummaryBuilder summary) {
        String topLevel = module.contains(".") ? module.substring(0, module.indexOf('.')) : module;
        if (!STANDARD_MODULES.contains(topLevel)) {
            summary.addReference(module, ReferenceKind.IMPORT, false);
        }
    }

    private static List<String> splitNames(String nameList) {
        String stripped = nameList.replace("(", "").replace(")", "").replace("\\", "");
        List<String> names = new ArrayList<>();
        for (String part : stripped.split(",")) {
            String name = ALIAS_PATTERN.matcher(part).replaceAll("").trim();
            if (!name.isEmpty() && !"*".equals(name)) {
                names.add(name);
            }
        }
        return names;
    }

    private static int countLeadingDots(String module) {
        int dots = 0;
        while (dots < module.length() && module.charAt(dots) == '.') {
            dots++;
        }
        return dots;
    }

    private static String relativePrefix(int dots) {
        return dots <= 1 ? "./" : "../".repeat(dots - 1);
    }
}
