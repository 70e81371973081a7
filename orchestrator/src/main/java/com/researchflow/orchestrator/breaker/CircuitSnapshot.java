package com.researchflow.orchestrator.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one endpoint's breaker.
 *
 * @param consecutiveFailures transport failures since the last success or reset
 * @param openedAt            when the circuit last opened, null while it is closed
 * @param cooldown            how long the current (or next) open period lasts
 * @param lastFailureAt       most recent transport failure, null if none
 */
public record CircuitSnapshot(CircuitState state,
                              int consecutiveFailures,
                              Instant openedAt,
                              Duration cooldown,
                              Instant lastFailureAt) {

    /** Instant at which an OPEN circuit admits its trial call; null in any other state. */
    public Instant retryAt() {
        return state == CircuitState.OPEN && openedAt != null ? openedAt.plus(cooldown) : null;
    }
}
