package com.archlens.core.assembler;

/**
 * Semantic layer and ordering priority suggested for a file.
 *
 * @param layer 0 = discovery, 1 = reasoning, 2 = action
 * @param priority ordering inside a layer, lower first
 */
public record LayerHint(int layer, int priority) {

    public static final int DISCOVERY = 0;
    public static final int REASONING = 1;
    public static final int ACTION = 2;
}
