package com.archlens.core.model;

import java.util.List;

/**
 * Input of the graph assembler: files, directories and resolved dependencies.
 *
 * @param folders project-relative directories (ancestors of files are derived anyway)
 * @param files files to lay out as nodes
 * @param dependencies resolved dependencies between files or to external modules
 * @param externalTokens external module tokens, in first-seen order
 */
public record ProjectStructure(
    List<String> folders,
    List<StructureFile> files,
    List<Dependency> dependencies,
    List<String> externalTokens
) {
    /**
     * Compact constructor with immutable copies.
     */
    public ProjectStructure {
        folders = folders == null ? List.of() : List.copyOf(folders);
        files = files == null ? List.of() : List.copyOf(files);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        externalTokens = externalTokens == null ? List.of() : List.copyOf(externalTokens);
    }
}
