package com.researchflow.orchestrator.agent;

import com.researchflow.orchestrator.agent.impl.StageSummaryAgent;
import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.pipeline.StageCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentHealthMonitorTest {

    @Mock AgentClient client;

    ExecutorService checkExecutor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        checkExecutor.shutdownNow();
    }

    @Test
    void checkAll_recordsRemoteResultsAndMarksLocalAgentsUp() {
        AgentEndpoint up   = new AgentEndpoint("agent-lit-retrieval", "http://agent-lit-retrieval:8000", Set.of("LIT_RETRIEVAL"));
        AgentEndpoint down = new AgentEndpoint("agent-lit-triage", "http://agent-lit-triage:8000", Set.of("LIT_TRIAGE"));
        AgentEndpoint local = new AgentEndpoint("stage-summary", "local:stage-summary", Set.of("STAGE_SUMMARY"));
        AgentRegistry registry = new AgentRegistry(List.of(up, down, local), new StageCatalog(List.of()),
                List.of(new StageSummaryAgent()));
        when(client.checkHealth(argThat(e -> e != null && e.id().equals("agent-lit-retrieval")), any())).thenReturn(true);
        when(client.checkHealth(argThat(e -> e != null && e.id().equals("agent-lit-triage")), any())).thenReturn(false);

        new AgentHealthMonitor(registry, client, new ResearchFlowProperties(), Runnable::run).checkAll();

        assertThat(registry.health("agent-lit-retrieval")).isEqualTo(AgentHealth.UP);
        assertThat(registry.health("agent-lit-triage")).isEqualTo(AgentHealth.DOWN);
        assertThat(registry.health("stage-summary")).isEqualTo(AgentHealth.UP);
        verify(client, never()).checkHealth(argThat(e -> e != null && e.isLocal()), any());
    }

    @Test
    void unreachableEndpoints_areCheckedSideBySide() {
        List<AgentEndpoint> endpoints = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            endpoints.add(new AgentEndpoint("agent-down-" + i, "http://agent-down-" + i + ":8000", Set.of("TASK_" + i)));
        }
        AgentRegistry registry = new AgentRegistry(endpoints, new StageCatalog(List.of()), List.of());
        when(client.checkHealth(any(), any())).thenAnswer(inv -> {
            Thread.sleep(400);                          // each check runs into its timeout
            return false;
        });
        AgentHealthMonitor monitor = new AgentHealthMonitor(registry, client, new ResearchFlowProperties(), checkExecutor);

        long started = System.nanoTime();
        monitor.checkAll();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isLessThan(Duration.ofMillis(1200));
        for (AgentEndpoint endpoint : endpoints) {
            assertThat(registry.health(endpoint.id())).isEqualTo(AgentHealth.DOWN);
        }
    }
}
