package com.researchflow.orchestrator.agent;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Routes a call to the in-process agent or to the remote proxy, depending on
 * the endpoint's address.
 */
@Component
public class EndpointAgentInvoker implements AgentInvoker {

    private final AgentRegistry registry;
    private final AgentClient   client;

    public EndpointAgentInvoker(AgentRegistry registry, AgentClient client) {
        this.registry = registry;
        this.client   = client;
    }

    @Override
    public AgentReply invoke(AgentEndpoint endpoint, String taskType, Map<String, Object> inputs, Duration timeout) {
        if (endpoint.isLocal()) {
            LocalAgent agent = registry.localAgent(endpoint.localName())
                    .orElseThrow(() -> new IllegalStateException(
                            "Local agent '" + endpoint.localName() + "' is not registered"));
            return agent.run(taskType, inputs);
        }
        return client.run(endpoint, taskType, inputs, timeout);
    }
}
