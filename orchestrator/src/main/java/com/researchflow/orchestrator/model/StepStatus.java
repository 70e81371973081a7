package com.researchflow.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle of one step inside one job attempt.
 *
 * PENDING → RUNNING → DONE | FAILED
 * PENDING → DONE     (satisfied by an artifact from an earlier attempt)
 * PENDING → SKIPPED  (an earlier strict step failed or the job was cancelled)
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(StepStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == DONE || next == SKIPPED;
            case RUNNING -> next == DONE || next == FAILED;
            case DONE, FAILED, SKIPPED -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
