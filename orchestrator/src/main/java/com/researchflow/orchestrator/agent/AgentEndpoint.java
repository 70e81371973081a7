package com.researchflow.orchestrator.agent;

import java.util.Set;

/**
 * A processing agent reachable at a fixed address.
 *
 * @param address {@code http(s)://host:port} for a remote proxy, or
 *                {@code local:<name>} for an in-process {@link LocalAgent}
 */
public record AgentEndpoint(String id, String address, Set<String> taskTypes) {

    public static final String LOCAL_SCHEME = "local:";

    public AgentEndpoint {
        taskTypes = Set.copyOf(taskTypes);
    }

    public boolean isLocal() {
        return address.startsWith(LOCAL_SCHEME);
    }

    /** Remote endpoints receive request text over the network and sit behind the PHI gate. */
    public boolean isExternal() {
        return !isLocal();
    }

    public String localName() {
        return address.substring(LOCAL_SCHEME.length());
    }
}
