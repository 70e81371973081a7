package com.researchflow.orchestrator.router;

import com.researchflow.orchestrator.agent.AgentCallException;
import com.researchflow.orchestrator.agent.AgentEndpoint;
import com.researchflow.orchestrator.agent.AgentRegistry;
import com.researchflow.orchestrator.agent.AgentReply;
import com.researchflow.orchestrator.agent.impl.StageSummaryAgent;
import com.researchflow.orchestrator.breaker.AgentCircuitBreakers;
import com.researchflow.orchestrator.breaker.CircuitState;
import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.config.ResilienceConfig;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.GovernanceMode;
import com.researchflow.orchestrator.phi.PatternPhiGate;
import com.researchflow.orchestrator.phi.PhiGate;
import com.researchflow.orchestrator.phi.PhiGateUnavailableException;
import com.researchflow.orchestrator.pipeline.StageCatalog;
import com.researchflow.orchestrator.support.FakeAgentInvoker;
import com.researchflow.orchestrator.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RouterDispatcher against a real registry, PHI gate and breakers, with a
 * call-counting fake standing in for the network.
 */
class RouterDispatcherTest {

    private static final String SCREEN  = "STAGE2_SCREEN";
    private static final String SUMMARY = StageSummaryAgent.TASK_TYPE;

    private FakeAgentInvoker       invoker;
    private AgentCircuitBreakers   breakers;
    private SimpleMeterRegistry    meters;
    private AgentRegistry          registry;
    private ExecutorService        executor;
    private RouterDispatcher       dispatcher;

    @BeforeEach
    void setUp() {
        invoker  = new FakeAgentInvoker();
        meters   = new SimpleMeterRegistry();
        breakers = new AgentCircuitBreakers(new ResearchFlowProperties.Breaker(),
                new MutableClock(Instant.parse("2026-01-05T10:00:00Z")), meters);
        registry = new AgentRegistry(List.of(
                        new AgentEndpoint("agent-stage2-screen", "http://agent-stage2-screen:8000", Set.of(SCREEN)),
                        new AgentEndpoint("stage-summary", "local:stage-summary", Set.of(SUMMARY))),
                new StageCatalog(List.of()),
                List.of(new StageSummaryAgent()));
        executor   = Executors.newCachedThreadPool();
        dispatcher = dispatcherWith(new PatternPhiGate(), Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RouterDispatcher dispatcherWith(PhiGate gate, Duration timeout) {
        ResearchFlowProperties.Dispatch settings = new ResearchFlowProperties.Dispatch();
        settings.setCallTimeout(timeout);
        return new RouterDispatcher(registry, invoker, gate, breakers, meters, executor,
                ResilienceConfig.agentTimeLimiter(settings));
    }

    private static Map<String, Object> input(String question) {
        return Map.of("workflow_id", "wf-001", "request", Map.of("research_question", question));
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void success_returnsOutputAndCountsCall() {
        DispatchResult result = dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).containsEntry("task_type", SCREEN);
        assertThat(invoker.calls(SCREEN)).isEqualTo(1);
        assertThat(meters.get("researchflow.dispatch.calls")
                .tag("task_type", SCREEN).tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("researchflow.dispatch.duration")
                .tag("endpoint", "agent-stage2-screen").timer().count()).isEqualTo(1);
    }

    @Test
    void unmappedTaskType_isFatal() {
        DispatchResult result = dispatcher.dispatch("NO_SUCH_TASK", input("anything at all here"), GovernanceMode.LIVE);

        assertThat(result.errorCode()).isEqualTo(ErrorCode.FATAL);
        assertThat(invoker.totalCalls()).isZero();
    }

    // ------------------------------------------------------------------
    // PHI gate
    // ------------------------------------------------------------------

    @Test
    void phiInInput_blocksBeforeAnyCall() {
        DispatchResult result = dispatcher.dispatch(SCREEN,
                input("Outcomes for patient 123-45-6789 after discharge"), GovernanceMode.DEMO);

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.PHI_BLOCKED);
        assertThat(result.message())
                .contains("request.research_question")
                .contains("SSN")
                .doesNotContain("123-45-6789");
        assertThat(invoker.calls(SCREEN)).isZero();
    }

    @Test
    void phiNestedInLists_isFound() {
        Map<String, Object> inputs = Map.of("prior_outputs",
                Map.of("screen", Map.of("notes", List.of("fine", "email jane@example.org"))));

        DispatchResult result = dispatcher.dispatch(SCREEN, inputs, GovernanceMode.LIVE);

        assertThat(result.errorCode()).isEqualTo(ErrorCode.PHI_BLOCKED);
        assertThat(result.message()).contains("prior_outputs.screen.notes[1]");
        assertThat(invoker.totalCalls()).isZero();
    }

    @Test
    void localAgent_isNotGated() {
        DispatchResult result = dispatcher.dispatch(SUMMARY,
                input("Outcomes for patient 123-45-6789 after discharge"), GovernanceMode.LIVE);

        assertThat(result.success()).isTrue();
        assertThat(invoker.calls(SUMMARY)).isEqualTo(1);
    }

    @Test
    void gateUnavailable_failsClosedAsTransient() {
        PhiGate down = text -> { throw new PhiGateUnavailableException("scanner down"); };

        DispatchResult result = dispatcherWith(down, Duration.ofMillis(300))
                .dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE);

        assertThat(result.errorCode()).isEqualTo(ErrorCode.TRANSIENT_ERROR);
        assertThat(invoker.totalCalls()).isZero();
    }

    // ------------------------------------------------------------------
    // Breaker and error normalization
    // ------------------------------------------------------------------

    @Test
    void fiveTransportFailures_thenCircuitOpenWithoutNetworkAttempt() {
        invoker.on(SCREEN, in -> { throw new AgentCallException(AgentCallException.Kind.NETWORK, "refused"); });

        for (int i = 0; i < 5; i++) {
            assertThat(dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE)
                    .errorCode()).isEqualTo(ErrorCode.TRANSIENT_ERROR);
        }
        DispatchResult sixth = dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE);

        assertThat(sixth.errorCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN);
        assertThat(invoker.calls(SCREEN)).isEqualTo(5);
        assertThat(breakers.snapshot("agent-stage2-screen").state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void agentLevelErrors_doNotTripTheBreaker() {
        invoker.on(SCREEN, in -> AgentReply.failed("model refused: internal detail"));

        DispatchResult last = null;
        for (int i = 0; i < 8; i++) {
            last = dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE);
        }

        assertThat(last.errorCode()).isEqualTo(ErrorCode.AGENT_ERROR);
        assertThat(last.message()).doesNotContain("internal detail");
        assertThat(invoker.calls(SCREEN)).isEqualTo(8);
        assertThat(breakers.snapshot("agent-stage2-screen").state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void agentFailure_keepsWhateverOutputItReturned() {
        invoker.on(SCREEN, in -> new AgentReply(false, Map.of("rows_screened", 2), "ran out of budget"));

        DispatchResult result = dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.DEMO);

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.AGENT_ERROR);
        assertThat(result.output()).containsEntry("rows_screened", 2);
        assertThat(result.message()).doesNotContain("budget");
    }

    @Test
    void localAgentCrash_isAgentErrorAndCountsAgainstTheBreaker() {
        invoker.on(SUMMARY, in -> { throw new IllegalStateException("boom"); });

        DispatchResult result = dispatcher.dispatch(SUMMARY, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE);

        assertThat(result.errorCode()).isEqualTo(ErrorCode.AGENT_ERROR);
        assertThat(result.message()).doesNotContain("boom");
        assertThat(breakers.snapshot("stage-summary").consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void httpErrors_areNormalized() {
        invoker.on(SCREEN, in -> { throw new AgentCallException(AgentCallException.Kind.SERVER_ERROR, "HTTP 503"); });
        assertThat(dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE)
                .errorCode()).isEqualTo(ErrorCode.TRANSIENT_ERROR);

        invoker.on(SCREEN, in -> { throw new AgentCallException(AgentCallException.Kind.REJECTED, "HTTP 422"); });
        assertThat(dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE)
                .errorCode()).isEqualTo(ErrorCode.AGENT_ERROR);

        invoker.on(SCREEN, in -> { throw new AgentCallException(AgentCallException.Kind.MALFORMED_RESPONSE, "not json"); });
        assertThat(dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.LIVE)
                .errorCode()).isEqualTo(ErrorCode.AGENT_ERROR);
    }

    @Test
    void slowAgent_timesOutAsTransient() {
        invoker.on(SCREEN, in -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AgentReply.ok(Map.of());
        });

        long started = System.nanoTime();
        DispatchResult result = dispatcher.dispatch(SCREEN, input("Does drug X reduce readmissions?"), GovernanceMode.DEMO);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.errorCode()).isEqualTo(ErrorCode.TRANSIENT_ERROR);
        assertThat(result.message()).contains("timed out");
        assertThat(elapsedMs).isLessThan(3_000);
        assertThat(breakers.snapshot("agent-stage2-screen").consecutiveFailures()).isEqualTo(1);
    }
}
