package com.archlens.core.resolver;

import com.archlens.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sorted index of the project-relative paths a reference may resolve to.
 *
 * <p>Every lookup returns candidates in lexicographic order, which makes resolution
 * deterministic for a fixed set of files.
 */
public final class FileIndex {

    private final TreeSet<String> paths = new TreeSet<>();
    private final Map<String, List<String>> byBaseName = new TreeMap<>();

    public FileIndex(Collection<String> files) {
        for (String file : files) {
            if (file != null && !file.isBlank()) {
                paths.add(FileUtils.normalize(file));
            }
        }
        for (String path : paths) {
            byBaseName.computeIfAbsent(FileUtils.baseName(path), key -> new ArrayList<>()).add(path);
        }
    }

    public boolean contains(String path) {
        return path != null && paths.contains(path);
    }

    /**
     * Returns the files whose name without extension equals the given base name.
     *
     * @param baseName base name such as "engine"
     * @return matching paths in sorted order
     */
    public List<String> findByBaseName(String baseName) {
        return byBaseName.getOrDefault(baseName, List.of());
    }

    /**
     * Returns the first file whose path equals the suffix or ends with "/" + suffix.
     *
     * @param suffix path suffix such as "core/engine.ts"
     * @param exclude path to skip, may be null
     * @return first match in sorted order
     */
    public Optional<String> findFirstBySuffix(String suffix, String exclude) {
        String slashed = "/" + suffix;
        for (String path : paths) {
            if (!path.equals(exclude) && (path.equals(suffix) || path.endsWith(slashed))) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }
}
