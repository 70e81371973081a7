package com.researchflow.orchestrator.pipeline;

import java.util.List;

/**
 * A numbered stage: its steps in execution order plus the request fields a
 * submission must carry.
 */
public record StageDefinition(int id, String name, List<StepDefinition> steps,
                              List<RequiredField> requiredFields) {

    public StageDefinition {
        steps          = List.copyOf(steps);
        requiredFields = List.copyOf(requiredFields);
    }

    /** A text field the request must contain, with its minimum trimmed length. */
    public record RequiredField(String name, int minLength) {}
}
