package com.researchflow.orchestrator.agent;

import java.time.Duration;
import java.util.Map;

/**
 * Performs one call against a resolved endpoint.
 *
 * Transport problems are raised as {@link AgentCallException}; a reply with
 * {@code success=false} is returned normally.
 */
public interface AgentInvoker {

    AgentReply invoke(AgentEndpoint endpoint, String taskType, Map<String, Object> inputs, Duration timeout);
}
