package com.archlens.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Control-flow reconstruction of a single file.
 *
 * @param id graph id ({@code flow_<file name>})
 * @param name display name
 * @param steps steps in emission order, the first is the start step
 */
public record StepGraph(
    String id,
    String name,
    List<FlowStep> steps
) {
    /**
     * Compact constructor with validation.
     */
    public StepGraph {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = id;
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public Optional<FlowStep> findStep(String stepId) {
        return steps.stream().filter(step -> step.id().equals(stepId)).findFirst();
    }

    public List<FlowStep> stepsOfKind(FlowStepKind kind) {
        return steps.stream().filter(step -> step.kind() == kind).toList();
    }
}
