package com.archlens.core.discovery;

import com.archlens.core.model.Language;
import com.archlens.core.model.NodeKind;
import com.archlens.core.model.StructureFile;
import com.archlens.core.util.FileUtils;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which node kind a discovered file becomes.
 *
 * <ul>
 *   <li>Markdown: documentation</li>
 *   <li>Test directories and test file names: test</li>
 *   <li>JSON, YAML and TOML: config</li>
 *   <li>Everything else: source</li>
 * </ul>
 */
public final class FileClassifier {

    private static final Set<String> TEST_DIRECTORIES = Set.of("test", "tests", "__tests__", "spec");

    /**
     * Regex for test file names.
     * Matches: test_login.py, login_test.py, engine.test.ts, engine.spec.js, parser_test.rs
     */
    private static final Pattern TEST_FILE_PATTERN = Pattern.compile(
        "^(test_.+|.+_test\\.\\w+|.+\\.(test|spec)\\.\\w+)$");

    private FileClassifier() {
        // Utility class
    }

    public static NodeKind classify(String path) {
        String normalized = FileUtils.normalize(path).toLowerCase(Locale.ROOT);
        Language language = Language.fromPath(normalized);
        if (language == Language.MARKDOWN) {
            return NodeKind.DOCUMENTATION;
        }
        if (isTest(normalized)) {
            return NodeKind.TEST;
        }
        if (language == Language.CONFIG) {
            return NodeKind.CONFIG;
        }
        return NodeKind.SOURCE;
    }

    /**
     * Creates the structure entry of a discovered file.
     *
     * @param path project-relative path
     * @return structure file with detected kind and a generated description
     */
    public static StructureFile toStructureFile(String path) {
        return new StructureFile(path, classify(path), FileUtils.fileName(path) + " (auto-detected)");
    }

    private static boolean isTest(String lowerPath) {
        String[] segments = lowerPath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (TEST_DIRECTORIES.contains(segments[i])) {
                return true;
            }
        }
        return TEST_FILE_PATTERN.matcher(segments[segments.length - 1]).matches();
    }
}
