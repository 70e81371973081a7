package com.researchflow.orchestrator.agent;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Calls {@code GET /health} on every remote endpoint and records the result
 * in the registry. In-process agents are always reported UP.
 *
 * Remote checks run side by side on their own executor, so a round takes
 * about one check timeout however many endpoints are down, and the shared
 * scheduler thread is back for the worker pool quickly.
 *
 * Health is informational: routing does not consult it, the circuit breaker
 * is what stops calls to a failing endpoint.
 */
@Component
public class AgentHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(AgentHealthMonitor.class);

    private final AgentRegistry registry;
    private final AgentClient   client;
    private final Duration      checkTimeout;
    private final Executor      checkExecutor;

    public AgentHealthMonitor(AgentRegistry registry,
                              AgentClient client,
                              ResearchFlowProperties properties,
                              @Qualifier("healthCheckExecutor") Executor checkExecutor) {
        this.registry      = registry;
        this.client        = client;
        this.checkTimeout  = properties.getHealth().getCheckTimeout();
        this.checkExecutor = checkExecutor;
    }

    @Scheduled(initialDelay = 5000, fixedDelayString = "${researchflow.health.check-interval-ms:30000}")
    public void checkAll() {
        List<CompletableFuture<Void>> checks = new ArrayList<>();
        for (AgentEndpoint endpoint : registry.endpoints()) {
            if (endpoint.isLocal()) {
                registry.recordHealth(endpoint.id(), AgentHealth.UP);
            } else {
                checks.add(CompletableFuture
                        .supplyAsync(() -> client.checkHealth(endpoint, checkTimeout), checkExecutor)
                        .thenAccept(up -> registry.recordHealth(endpoint.id(), up ? AgentHealth.UP : AgentHealth.DOWN)));
            }
        }
        try {
            CompletableFuture.allOf(checks.toArray(new CompletableFuture[0])).join();
        } catch (RuntimeException e) {
            log.warn("Health check round ended with an error: {}", e.getMessage(), e);
        }
    }
}
