package com.researchflow.orchestrator.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Body of an agent's answer to {@code POST {endpoint}/run}.
 *
 * {@code success=false} is an agent-level error: the endpoint is healthy,
 * the task was not accomplished.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentReply(boolean success, Map<String, Object> output, String error) {

    public static AgentReply ok(Map<String, Object> output) {
        return new AgentReply(true, output, null);
    }

    public static AgentReply failed(String error) {
        return new AgentReply(false, null, error);
    }
}
