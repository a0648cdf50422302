package com.archlens.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Source languages recognized by file extension.
 *
 * <p>Extensions are matched case-insensitively and include the leading dot.
 * Files whose extension is not listed map to {@link #UNKNOWN}.
 */
public enum Language {
    CPP("cpp", BlockStyle.BRACE, ".c", ".h", ".cpp", ".hpp", ".cc"),
    JAVASCRIPT("javascript", BlockStyle.BRACE, ".js"),
    TYPESCRIPT("typescript", BlockStyle.BRACE, ".ts"),
    RUST("rust", BlockStyle.BRACE, ".rs"),
    PYTHON("python", BlockStyle.INDENT, ".py"),
    SHELL("shell", BlockStyle.NONE, ".sh"),
    SQL("sql", BlockStyle.DECLARATIVE, ".sql"),
    CONFIG("config", BlockStyle.DECLARATIVE, ".json", ".yaml", ".yml", ".toml"),
    MARKDOWN("markdown", BlockStyle.DECLARATIVE, ".md"),
    UNKNOWN("unknown", BlockStyle.NONE);

    private final String id;
    private final BlockStyle blockStyle;
    private final List<String> extensions;

    Language(String id, BlockStyle blockStyle, String... extensions) {
        this.id = id;
        this.blockStyle = blockStyle;
        this.extensions = List.of(extensions);
    }

    /**
     * Returns the lowercase language identifier (e.g. "typescript").
     *
     * @return language identifier
     */
    public String id() {
        return id;
    }

    public BlockStyle blockStyle() {
        return blockStyle;
    }

    /**
     * Returns the file extensions of this language, each with a leading dot.
     *
     * @return extensions in declaration order
     */
    public List<String> extensions() {
        return extensions;
    }

    /**
     * Detects the language of a path from its extension.
     *
     * @param path file path or name, '/' or '\' separated
     * @return detected language, {@link #UNKNOWN} when the extension is not recognized
     */
    public static Language fromPath(String path) {
        if (path == null) {
            return UNKNOWN;
        }
        String extension = extensionOf(path);
        if (extension.isEmpty()) {
            return UNKNOWN;
        }
        for (Language language : values()) {
            if (language.extensions.contains(extension)) {
                return language;
            }
        }
        return UNKNOWN;
    }

    /**
     * Returns the lowercase extension of a path including the dot, or an empty string.
     *
     * @param path file path or name
     * @return extension such as ".ts", or "" when the file name has none
     */
    public static String extensionOf(String path) {
        String normalized = path.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Returns every extension of every recognized language, in declaration order.
     *
     * @return all supported extensions
     */
    public static List<String> allExtensions() {
        return Arrays.stream(values())
            .flatMap(language -> language.extensions.stream())
            .toList();
    }
}
