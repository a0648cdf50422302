package com.archlens.core.model;

import java.util.Objects;

/**
 * One step of a reconstructed control-flow graph.
 *
 * @param id step id, unique within its step graph
 * @param kind step kind
 * @param label display label (condition text, call name, ...)
 * @param tag semantic tag for process steps
 * @param next following step id (true branch for decisions), may be null
 * @param alternateNext false-branch step id, decisions only, may be null
 * @param hidden true for synthetic join points
 */
public record FlowStep(
    String id,
    FlowStepKind kind,
    String label,
    StepTag tag,
    String next,
    String alternateNext,
    boolean hidden
) {
    /**
     * Compact constructor with validation.
     */
    public FlowStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (label == null) {
            label = "";
        }
        if (tag == null) {
            tag = StepTag.NONE;
        }
    }
}
