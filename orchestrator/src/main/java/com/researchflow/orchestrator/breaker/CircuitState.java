package com.researchflow.orchestrator.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.util.Locale;

/**
 * CLOSED      calls flow; transport failures are counted.
 * OPEN        calls are rejected without touching the network until the cooldown ends.
 * HALF_OPEN   exactly one trial call is in flight; its outcome closes or reopens the circuit.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public static CircuitState of(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN         -> HALF_OPEN;
            default                -> CLOSED;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
