package com.researchflow.orchestrator.agent;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.pipeline.StageCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Static task type → endpoint table, resolved once at startup.
 *
 * Endpoints come from {@code researchflow.agents}; every {@link LocalAgent}
 * bean is collected through constructor injection and bound to the
 * endpoints addressed as {@code local:<name>}.
 *
 * Construction fails with {@link IllegalStateException} when:
 * <ol>
 *   <li>a remote address is not an absolute http(s) URL</li>
 *   <li>a {@code local:} address names no LocalAgent bean</li>
 *   <li>two endpoints claim the same task type</li>
 *   <li>a task type used by any stage step has no endpoint</li>
 * </ol>
 * so a misconfigured catalog never reaches the worker pool.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentEndpoint> endpointsById = new LinkedHashMap<>();
    private final Map<String, AgentEndpoint> byTaskType    = new HashMap<>();
    private final Map<String, LocalAgent>    localAgents   = new HashMap<>();
    private final Map<String, AgentHealth>   health        = new ConcurrentHashMap<>();

    @Autowired
    public AgentRegistry(ResearchFlowProperties properties, StageCatalog catalog, List<LocalAgent> localAgents) {
        this(toEndpoints(properties.getAgents()), catalog, localAgents);
    }

    public AgentRegistry(Collection<AgentEndpoint> endpoints, StageCatalog catalog, List<LocalAgent> agents) {
        for (LocalAgent agent : agents) {
            if (localAgents.put(agent.name(), agent) != null) {
                throw new IllegalStateException("Two local agents are named '" + agent.name() + "'");
            }
        }
        for (AgentEndpoint endpoint : endpoints) {
            register(endpoint);
        }
        for (String taskType : catalog.referencedTaskTypes()) {
            if (!byTaskType.containsKey(taskType)) {
                throw new IllegalStateException(
                        "Task type '" + taskType + "' is used by the stage catalog but no agent endpoint serves it");
            }
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * @throws UnmappedTaskTypeException when no endpoint serves the task type
     */
    public AgentEndpoint resolve(String taskType) {
        AgentEndpoint endpoint = byTaskType.get(taskType);
        if (endpoint == null) {
            throw new UnmappedTaskTypeException(taskType);
        }
        return endpoint;
    }

    public List<AgentEndpoint> endpoints() {
        return List.copyOf(endpointsById.values());
    }

    public Optional<LocalAgent> localAgent(String name) {
        return Optional.ofNullable(localAgents.get(name));
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    public AgentHealth health(String endpointId) {
        return health.getOrDefault(endpointId, AgentHealth.UNKNOWN);
    }

    public void recordHealth(String endpointId, AgentHealth value) {
        AgentHealth previous = health.put(endpointId, value);
        if (previous != null && previous != value) {
            log.info("Agent endpoint '{}' health changed: {} -> {}", endpointId, previous, value);
        }
    }

    // ------------------------------------------------------------------
    // Construction helpers
    // ------------------------------------------------------------------

    private void register(AgentEndpoint endpoint) {
        if (endpoint.isLocal()) {
            if (!localAgents.containsKey(endpoint.localName())) {
                throw new IllegalStateException("Endpoint '" + endpoint.id()
                        + "' points at unknown local agent '" + endpoint.localName() + "'");
            }
        } else {
            requireHttpUrl(endpoint);
        }
        if (endpointsById.put(endpoint.id(), endpoint) != null) {
            throw new IllegalStateException("Endpoint '" + endpoint.id() + "' is defined twice");
        }
        for (String taskType : endpoint.taskTypes()) {
            AgentEndpoint clash = byTaskType.put(taskType, endpoint);
            if (clash != null) {
                throw new IllegalStateException("Task type '" + taskType + "' is claimed by both '"
                        + clash.id() + "' and '" + endpoint.id() + "'");
            }
        }
        log.info("Registered agent endpoint '{}' at {} for {}",
                endpoint.id(), endpoint.address(), endpoint.taskTypes());
    }

    private static void requireHttpUrl(AgentEndpoint endpoint) {
        try {
            URI uri = URI.create(endpoint.address());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equals(scheme) || "https".equals(scheme))) {
                throw new IllegalStateException("Endpoint '" + endpoint.id()
                        + "' must use an absolute http(s) URL, got: " + endpoint.address());
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Endpoint '" + endpoint.id()
                    + "' has an unparseable address: " + endpoint.address(), e);
        }
    }

    private static List<AgentEndpoint> toEndpoints(Map<String, ResearchFlowProperties.Agent> config) {
        List<AgentEndpoint> result = new ArrayList<>();
        config.forEach((id, agent) -> result.add(
                new AgentEndpoint(id, agent.getAddress().trim(), Set.copyOf(agent.getTaskTypes()))));
        return result;
    }
}
