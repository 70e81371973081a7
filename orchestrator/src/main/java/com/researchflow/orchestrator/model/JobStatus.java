package com.researchflow.orchestrator.model;

import java.util.Locale;

/**
 * Lifecycle of a stage job.
 *
 * QUEUED → ACTIVE → COMPLETED | FAILED
 *
 * A queued job can also fail directly (cancelled before it was claimed).
 * A job waiting for a retry stays ACTIVE; the retry flag on the row marks it
 * as claimable again once its availability time passes.
 */
public enum JobStatus {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED    -> next == ACTIVE || next == FAILED;
            case ACTIVE    -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /** Lower-case form used on the wire. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
