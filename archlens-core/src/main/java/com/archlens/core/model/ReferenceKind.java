package com.archlens.core.model;

/**
 * Syntactic origin of a raw reference token.
 */
public enum ReferenceKind {
    IMPORT,
    INCLUDE,
    REQUIRE,
    USE,
    LINK,
    CONFIG,
    SCRIPT
}
