package com.archlens.core.model;

/**
 * Kinds of declared symbols.
 */
public enum SymbolKind {
    /** Class, struct, interface, enum, trait, table or document section. */
    TYPE,

    /** Function, method, procedure or view. */
    FUNCTION
}
