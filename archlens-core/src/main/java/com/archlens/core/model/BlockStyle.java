package com.archlens.core.model;

/**
 * How a language delimits nested blocks.
 *
 * <p>Drives both the choice of extractor family and the block delimiter used by
 * the control-flow reconstructor.
 */
public enum BlockStyle {
    /** Curly-brace blocks (C/C++, JavaScript, TypeScript, Rust). */
    BRACE,

    /** Indentation blocks (Python). */
    INDENT,

    /** Declarative content without executable blocks (SQL, config, Markdown). */
    DECLARATIVE,

    /** No recognized block structure. */
    NONE
}
