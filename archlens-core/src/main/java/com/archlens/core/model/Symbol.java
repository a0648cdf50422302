package com.archlens.core.model;

import java.util.Objects;

/**
 * A symbol declared in a file.
 *
 * <p>Names are unique only within one file's summary.
 *
 * @param name declared name
 * @param kind symbol kind
 * @param file owning file path
 */
public record Symbol(
    String name,
    SymbolKind kind,
    String file
) {
    /**
     * Compact constructor with validation.
     */
    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(file, "file must not be null");
    }
}
