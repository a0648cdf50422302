package com.archlens.core.extractor.impl.brace;

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
 * Extractor for Rust sources.
 *
 * <p><b>Recognized constructs:</b>
 * <ul>
 *   <li>Types: {@code struct}, {@code enum}, {@code trait}, {@code union} and the
 *       target type of {@code impl} blocks</li>
 *   <li>Functions: {@code fn} with any visibility, {@code const}, {@code async},
 *       {@code unsafe} and {@code extern} qualifiers</li>
 *   <li>References: {@code use} paths and {@code mod name;} declarations</li>
 * </ul>
 *
 * <p>{@code use crate::..}, {@code self::..} and {@code super::..} paths are
 * same-project references reduced to the innermost module segment, the last
 * lowercase segment before the imported item ({@code crate::graph::Node} becomes
 * {@code graph}). Paths into {@code std}, {@code core} and {@code alloc} are dropped;
 * any other path names an external crate.
 */
public class RustExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "rust";
    private static final String EXTRACTOR_DISPLAY_NAME = "Rust Extractor";

    /**
     * Regex for type declarations.
     * Captures: (1) type name.
     */
    private static final Pattern TYPE_PATTERN = Pattern.compile(
        "^[ \\t]*(?:pub(?:\\([^)]*\\))?[ \\t]+)?(?:unsafe[ \\t]+)?(?:struct|enum|trait|union)[ \\t]+([A-Za-z_]\\w*)",
        Pattern.MULTILINE
    );

    /**
     * Regex for impl blocks: impl<T> Display for Wrapper<T> {.
     * Captures: (1) implemented trait or inherent type, (2) target type when a trait is implemented.
     */
    private static final Pattern IMPL_PATTERN = Pattern.compile(
        "^[ \\t]*(?:unsafe[ \\t]+)?impl(?:[ \\t]*<[^>]*>)?[ \\t]+([A-Za-z_][\\w:]*)(?:<[^>{]*>)?(?:[ \\t]+for[ \\t]+([A-Za-z_][\\w:]*))?",
        Pattern.MULTILINE
    );

    /**
     * Regex for function declarations.
     * Captures: (1) function name.
     */
    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
        "^[ \\t]*(?:pub(?:\\([^)]*\\))?[ \\t]+)?(?:default[ \\t]+)?(?:const[ \\t]+)?(?:async[ \\t]+)?(?:unsafe[ \\t]+)?(?:extern[ \\t]+\"[^\"]*\"[ \\t]+)?fn[ \\t]+([A-Za-z_]\\w*)",
        Pattern.MULTILINE
    );

    /**
     * Regex for use declarations.
     * Captures: (1) use tree up to the semicolon.
     */
    private static final Pattern USE_PATTERN = Pattern.compile(
        "^[ \\t]*(?:pub(?:\\([^)]*\\))?[ \\t]+)?use[ \\t]+([^;]+);",
        Pattern.MULTILINE
    );

    /**
     * Regex for out-of-line module declarations: mod parser;.
     * Captures: (1) module name.
     */
    private static final Pattern MOD_PATTERN = Pattern.compile(
        "^[ \\t]*(?:pub(?:\\([^)]*\\))?[ \\t]+)?mod[ \\t]+([a-z_]\\w*)[ \\t]*;",
        Pattern.MULTILINE
    );

    private static final Pattern ALIAS_PATTERN = Pattern.compile("\\s+as\\s+\\w+");

    private static final Set<String> LOCAL_ROOTS = Set.of("crate", "self", "super");
    private static final Set<String> STANDARD_CRATES = Set.of("std", "core", "alloc");

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
        return Set.of(Language.RUST);
    }

    @Override
    protected Set<String> getKeywords() {
        return Set.of("if", "while", "for", "match", "loop", "return");
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        String content = stripCStyleComments(file.content());

        for (MatchResult match : findMatches(TYPE_PATTERN, content)) {
            summary.addType(match.group(1));
        }
        for (MatchResult match : findMatches(IMPL_PATTERN, content)) {
            String target = firstGroup(match, 2, 1);
            summary.addType(lastPathSegment(target));
        }

        for (MatchResult match : findMatches(FUNCTION_PATTERN, content)) {
            summary.addFunction(match.group(1));
        }

        for (MatchResult match : findMatches(USE_PATTERN, content)) {
            addUseReference(match.group(1), summary);
        }
        for (MatchResult match : findMatches(MOD_PATTERN, content)) {
            summary.addReference(match.group(1), ReferenceKind.USE, true);
        }
    }

    private void addUseReference(String useTree, SummaryBuilder summary) {
        String path = ALIAS_PATTERN.matcher(useTree).replaceAll("").replaceAll("\\s+", "");
        int groupStart = path.indexOf('{');
        if (groupStart >= 0) {
            path = path.substring(0, groupStart);
        }
        if (path.startsWith("::")) {
            path = path.substring(2);
        }

        List<String> segments = new ArrayList<>();
        for (String segment : path.split("::")) {
            if (!segment.isEmpty() && !"*".equals(segment)) {
                segments.add(segment);
            }
        }
        if (segments.isEmpty()) {
            return;
        }

        String root = segments.get(0);
        if (STANDARD_CRATES.contains(root)) {
            return;
        }
        if (!LOCAL_ROOTS.contains(root)) {
            summary.addReference(root, ReferenceKind.USE, false);
            return;
        }

        List<String> modules = segments.stream()
            .filter(segment -> !LOCAL_ROOTS.contains(segment))
            .toList();
        String module = innermostModule(modules, groupStart >= 0 || path.endsWith("::"));
        if (module != null) {
            summary.addReference(module, ReferenceKind.USE, true);
        }
    }

    /**
     * Picks the last lowercase segment that names a module rather than the imported item.
     *
     * @param segments path segments without crate/self/super
     * @param endsWithGroup true when the path ended in a {...} group, so every segment is a module
     * @return module name, or null when the path names no module
     */
    private static String innermostModule(List<String> segments, boolean endsWithGroup) {
        if (segments.isEmpty()) {
            return null;
        }
        int lastModuleIndex = endsWithGroup || segments.size() == 1 ? segments.size() - 1 : segments.size() - 2;
        for (int i = lastModuleIndex; i >= 0; i--) {
            String segment = segments.get(i);
            if (Character.isLowerCase(segment.charAt(0)) || segment.charAt(0) == '_') {
                return segment;
            }
        }
        return null;
    }

    private static String lastPathSegment(String path) {
        if (path == null) {
            return null;
        }
        int separator = path.lastIndexOf("::");
        return separator >= 0 ? path.substring(separator + 2) : path;
    }
}
