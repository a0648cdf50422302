package com.archlens.core.discovery;

import java.util.List;

/**
 * Result of one project walk.
 *
 * @param directories project-relative directories, sorted
 * @param files project-relative files of recognized languages, sorted
 */
public record TreeListing(
    List<String> directories,
    List<String> files
) {
    /**
     * Compact constructor with immutable copies.
     */
    public TreeListing {
        directories = directories == null ? List.of() : List.copyOf(directories);
        files = files == null ? List.of() : List.copyOf(files);
    }
}
