package com.archlens.core.flow;

import com.archlens.core.model.FlowStep;
import com.archlens.core.model.FlowStepKind;
import com.archlens.core.model.StepTag;

/**
 * Mutable step used while the graph is being wired.
 */
final class StepDraft {

    private final String id;
    private final FlowStepKind kind;
    private final String label;
    private final StepTag tag;
    private final boolean hidden;
    private String next;
    private String alternateNext;

    StepDraft(String id, FlowStepKind kind, String label, StepTag tag, boolean hidden) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.tag = tag;
        this.hidden = hidden;
    }

    String id() {
        return id;
    }

    FlowStepKind kind() {
        return kind;
    }

    String next() {
        return next;
    }

    void next(String next) {
        this.next = next;
    }

    String alternateNext() {
        return alternateNext;
    }

    void alternateNext(String alternateNext) {
        this.alternateNext = alternateNext;
    }

    FlowStep toStep() {
        return new FlowStep(id, kind, label, tag, next, alternateNext, hidden);
    }
}
