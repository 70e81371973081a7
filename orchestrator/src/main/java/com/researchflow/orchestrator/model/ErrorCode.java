package com.researchflow.orchestrator.model;

/**
 * Failure taxonomy shared by steps, jobs, events and API error bodies.
 *
 * Only TRANSIENT_ERROR is eligible for a job-level retry; every other code
 * is final for the attempt that produced it.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    TRANSIENT_ERROR,
    PHI_BLOCKED,
    CIRCUIT_OPEN,
    AGENT_ERROR,
    FATAL,
    CANCELLED;

    public boolean isRetryable() {
        return this == TRANSIENT_ERROR;
    }
}
