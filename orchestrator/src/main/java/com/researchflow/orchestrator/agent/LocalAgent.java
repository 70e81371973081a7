package com.researchflow.orchestrator.agent;

import java.util.Map;

/**
 * An agent that runs inside the orchestrator JVM.
 *
 * Every {@code LocalAgent} bean is collected by {@link AgentRegistry} and is
 * addressed from the endpoint table as {@code local:<name>}.
 */
public interface LocalAgent {

    /** Name used in the {@code local:<name>} address. */
    String name();

    AgentReply run(String taskType, Map<String, Object> inputs);
}
