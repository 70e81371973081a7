package com.researchflow.orchestrator.agent;

import java.util.Locale;

/** Result of the latest health check for an endpoint. */
public enum AgentHealth {
    UNKNOWN,
    UP,
    DOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
