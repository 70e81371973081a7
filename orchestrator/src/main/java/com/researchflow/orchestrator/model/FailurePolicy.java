package com.researchflow.orchestrator.model;

/**
 * What a step failure does to the rest of the pipeline.
 */
public enum FailurePolicy {
    /** Failure aborts the stage; remaining steps are skipped. */
    STRICT,
    /** Failure is recorded as a warning and the pipeline continues. */
    BEST_EFFORT
}
