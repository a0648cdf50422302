package com.archlens.core.assembler;

/**
 * Supplies the semantic layer and priority of a file to the {@link GraphAssembler}.
 */
@FunctionalInterface
public interface LayerClassifier {

    /**
     * Classifies a project file.
     *
     * @param path project-relative path
     * @return layer hint, never null
     */
    LayerHint classify(String path);
}
