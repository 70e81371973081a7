package com.researchflow.orchestrator.api.dto;

import com.researchflow.orchestrator.agent.AgentEndpoint;
import com.researchflow.orchestrator.agent.AgentHealth;
import com.researchflow.orchestrator.breaker.CircuitSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * One agent endpoint as seen by GET /agents.
 */
public record AgentStatusResponse(
        String       id,
        String       address,
        List<String> taskTypes,
        String       health,
        Circuit      circuit
) {

    public record Circuit(String state, int consecutiveFailures, Instant openedAt, Instant retryAt) {}

    public static AgentStatusResponse from(AgentEndpoint endpoint, AgentHealth health, CircuitSnapshot snapshot) {
        return new AgentStatusResponse(
                endpoint.id(),
                endpoint.address(),
                endpoint.taskTypes().stream().sorted().toList(),
                health.wireName(),
                new Circuit(snapshot.state().wireName(), snapshot.consecutiveFailures(),
                        snapshot.openedAt(), snapshot.retryAt())
        );
    }
}
