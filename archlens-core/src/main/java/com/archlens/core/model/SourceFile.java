package com.archlens.core.model;

import java.util.Objects;

/**
 * A project file handed to the extractors and the flow reconstructor.
 *
 * @param path project-relative path, '/'-normalized
 * @param language language detected from the extension
 * @param content file content (empty when unreadable)
 */
public record SourceFile(
    String path,
    Language language,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        path = path.replace('\\', '/');
        if (language == null) {
            language = Language.fromPath(path);
        }
        if (content == null) {
            content = "";
        }
    }

    /**
     * Creates a source file whose language is detected from the path.
     *
     * @param path project-relative path
     * @param content file content
     * @return source file
     */
    public static SourceFile of(String path, String content) {
        return new SourceFile(path, null, content);
    }

    /**
     * Returns the file name without directories.
     *
     * @return file name
     */
    public String fileName() {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
