package com.researchflow.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchflow.orchestrator.phi.PatternPhiGate;
import com.researchflow.orchestrator.phi.PhiGate;
import com.researchflow.orchestrator.phi.RemotePhiGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure beans shared by the dispatch and worker layers.
 */
@Configuration
@EnableConfigurationProperties(ResearchFlowProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Threads that carry agent calls so the dispatcher can bound them with a
     * timeout. Unbounded: concurrency is already capped by the worker pool.
     */
    @Bean(name = "agentCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-call-"));
    }

    /** Health checks of remote endpoints, run side by side. */
    @Bean(name = "healthCheckExecutor", destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor(ResearchFlowProperties properties) {
        return Executors.newFixedThreadPool(properties.getHealth().getCheckThreads(),
                new CustomizableThreadFactory("health-check-"));
    }

    /**
     * Hands queued progress events to stream subscribers, one drain at a
     * time per subscriber, so no writer waits on a slow client.
     */
    @Bean(name = "eventDeliveryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService eventDeliveryExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("event-delivery-"));
    }

    @Bean
    public PhiGate phiGate(ResearchFlowProperties properties, ObjectMapper objectMapper) {
        ResearchFlowProperties.Phi phi = properties.getPhi();
        if (StringUtils.hasText(phi.getScannerUrl())) {
            log.info("PHI gate: external scanner at {}", phi.getScannerUrl());
            return new RemotePhiGate(phi.getScannerUrl(), phi.getScanTimeout(), objectMapper);
        }
        log.info("PHI gate: built-in pattern scanner ({} extra pattern(s))", phi.getExtraPatterns().size());
        return new PatternPhiGate(phi.getExtraPatterns());
    }
}
