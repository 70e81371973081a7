package com.researchflow.orchestrator.api;

import com.researchflow.orchestrator.agent.AgentRegistry;
import com.researchflow.orchestrator.api.dto.AgentStatusResponse;
import com.researchflow.orchestrator.breaker.AgentCircuitBreakers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /agents: every configured endpoint with its last checked health and
 * current circuit state.
 */
@RestController
@RequestMapping("/agents")
public class AgentController {

    private final AgentRegistry          registry;
    private final AgentCircuitBreakers   breakers;

    public AgentController(AgentRegistry registry, AgentCircuitBreakers breakers) {
        this.registry = registry;
        this.breakers = breakers;
    }

    @GetMapping
    public List<AgentStatusResponse> list() {
        return registry.endpoints().stream()
                .map(endpoint -> AgentStatusResponse.from(endpoint,
                        registry.health(endpoint.id()),
                        breakers.snapshot(endpoint.id())))
                .toList();
    }
}
