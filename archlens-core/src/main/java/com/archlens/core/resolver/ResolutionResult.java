package com.archlens.core.resolver;

import com.archlens.core.model.Dependency;

import java.util.List;

/**
 * Output of reference resolution.
 *
 * @param dependencies resolved file-to-file and file-to-external dependencies, deduplicated
 * @param externalTokens tokens materialized as external modules, in first-seen order
 */
public record ResolutionResult(
    List<Dependency> dependencies,
    List<String> externalTokens
) {
    public ResolutionResult {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        externalTokens = externalTokens == null ? List.of() : List.copyOf(externalTokens);
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), List.of());
    }
}
