package com.archlens.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Utility class for path and file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Converts a path to a project-relative, '/'-separated string.
     *
     * @param rootPath project root
     * @param path file or directory inside the root
     * @return relative path such as "src/core/engine.ts"
     */
    public static String toRelativePath(Path rootPath, Path path) {
        return normalize(rootPath.toAbsolutePath().normalize()
            .relativize(path.toAbsolutePath().normalize())
            .toString());
    }

    /**
     * Normalizes separators to '/' and strips a leading "./".
     *
     * @param path raw path
     * @return normalized path
     */
    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    /**
     * Returns the parent directory of a '/'-separated path, or "." for root-level files.
     *
     * @param path project-relative path
     * @return parent directory
     */
    public static String parentOf(String path) {
        int lastSlash = path.lastIndexOf('/');
        return lastSlash > 0 ? path.substring(0, lastSlash) : ".";
    }

    /**
     * Returns the file name of a '/'-separated path.
     *
     * @param path project-relative path
     * @return last path segment
     */
    public static String fileName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Returns the file name without its last extension.
     *
     * @param path project-relative path or token
     * @return base name, e.g. "engine" for "src/engine.ts"
     */
    public static String baseName(String path) {
        String fileName = fileName(path);
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Joins a directory and a relative path, resolving "." and ".." segments.
     *
     * @param directory base directory ("." for the project root)
     * @param relative relative path such as "../lib/util"
     * @return normalized project-relative path, or null when it escapes the root
     */
    public static String join(String directory, String relative) {
        String combined = ".".equals(directory) ? relative : directory + "/" + relative;
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : combined.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    /**
     * Reads a file as UTF-8 text.
     *
     * @param path path to file
     * @return file content
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
