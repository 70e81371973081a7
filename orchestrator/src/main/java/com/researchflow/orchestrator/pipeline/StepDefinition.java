package com.researchflow.orchestrator.pipeline;

import com.researchflow.orchestrator.model.FailurePolicy;
import com.researchflow.orchestrator.model.GovernanceMode;

/**
 * One entry of a stage's ordered step list.
 *
 * @param order        zero-based position in the stage
 * @param demoPolicy   failure policy under DEMO; LIVE is always strict
 */
public record StepDefinition(String name, int order, String taskType, FailurePolicy demoPolicy) {

    public FailurePolicy policyFor(GovernanceMode mode) {
        return mode == GovernanceMode.DEMO ? demoPolicy : FailurePolicy.STRICT;
    }
}
