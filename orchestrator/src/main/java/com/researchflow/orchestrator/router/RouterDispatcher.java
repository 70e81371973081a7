package com.researchflow.orchestrator.router;

import com.researchflow.orchestrator.agent.AgentCallException;
import com.researchflow.orchestrator.agent.AgentEndpoint;
import com.researchflow.orchestrator.agent.AgentInvoker;
import com.researchflow.orchestrator.agent.AgentRegistry;
import com.researchflow.orchestrator.agent.AgentReply;
import com.researchflow.orchestrator.agent.UnmappedTaskTypeException;
import com.researchflow.orchestrator.breaker.AgentCircuitBreakers;
import com.researchflow.orchestrator.breaker.CircuitSnapshot;
import com.researchflow.orchestrator.model.ErrorCode;
import com.researchflow.orchestrator.model.GovernanceMode;
import com.researchflow.orchestrator.phi.PhiGate;
import com.researchflow.orchestrator.phi.PhiGateUnavailableException;
import com.researchflow.orchestrator.phi.PhiScanResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Sends one step's input to the agent that serves its task type.
 *
 * Per call:
 * <ol>
 *   <li>resolve the endpoint from the static registry</li>
 *   <li>for a remote endpoint, scan every string in the input with the PHI gate</li>
 *   <li>invoke the agent through the endpoint's circuit breaker, under the call time limit</li>
 *   <li>fold whatever happened into a {@link DispatchResult}</li>
 * </ol>
 *
 * Outcome mapping:
 * <pre>
 *   unmapped task type                     → FATAL
 *   PHI flagged                            → PHI_BLOCKED       (no call made)
 *   PHI gate unavailable                   → TRANSIENT_ERROR   (no call made)
 *   breaker open                           → CIRCUIT_OPEN      (no call made)
 *   network error, timeout, HTTP 5xx / 429 → TRANSIENT_ERROR   (breaker failure)
 *   HTTP 4xx, malformed body               → AGENT_ERROR
 *   success=false                          → AGENT_ERROR
 * </pre>
 *
 * Metrics:
 * <pre>
 *   researchflow.dispatch.calls{task_type, outcome}
 *   researchflow.dispatch.duration{task_type, endpoint}
 * </pre>
 */
@Component
public class RouterDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RouterDispatcher.class);

    private final AgentRegistry          registry;
    private final AgentInvoker           invoker;
    private final PhiGate                phiGate;
    private final AgentCircuitBreakers   breakers;
    private final MeterRegistry          meterRegistry;
    private final ExecutorService        callExecutor;
    private final TimeLimiter            timeLimiter;
    private final Duration               callTimeout;

    public RouterDispatcher(AgentRegistry registry,
                            AgentInvoker invoker,
                            PhiGate phiGate,
                            AgentCircuitBreakers breakers,
                            MeterRegistry meterRegistry,
                            @Qualifier("agentCallExecutor") ExecutorService callExecutor,
                            TimeLimiter timeLimiter) {
        this.registry      = registry;
        this.invoker       = invoker;
        this.phiGate       = phiGate;
        this.breakers      = breakers;
        this.meterRegistry = meterRegistry;
        this.callExecutor  = callExecutor;
        this.timeLimiter   = timeLimiter;
        this.callTimeout   = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public DispatchResult dispatch(String taskType, Map<String, Object> inputs, GovernanceMode mode) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String endpointTag = "unresolved";
        DispatchResult result;
        try {
            AgentEndpoint endpoint = registry.resolve(taskType);
            endpointTag = endpoint.id();
            result = dispatchTo(endpoint, taskType, inputs);
        } catch (UnmappedTaskTypeException e) {
            result = DispatchResult.failure(ErrorCode.FATAL, e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("researchflow.dispatch.duration",
                    "task_type", taskType, "endpoint", endpointTag));
        }
        meterRegistry.counter("researchflow.dispatch.calls",
                "task_type", taskType, "outcome", result.outcome()).increment();
        log.info("Dispatched task_type={} endpoint={} mode={} outcome={}",
                taskType, endpointTag, mode, result.outcome());
        return result;
    }

    // ------------------------------------------------------------------
    // Pipeline: PHI gate → breaker → timed call
    // ------------------------------------------------------------------

    private DispatchResult dispatchTo(AgentEndpoint endpoint, String taskType, Map<String, Object> inputs) {
        if (endpoint.isExternal()) {
            try {
                Optional<String> blocked = findPhi(inputs);
                if (blocked.isPresent()) {
                    return DispatchResult.failure(ErrorCode.PHI_BLOCKED, blocked.get());
                }
            } catch (PhiGateUnavailableException e) {
                return DispatchResult.failure(ErrorCode.TRANSIENT_ERROR,
                        "PHI gate unavailable; nothing was sent to " + endpoint.id());
            }
        }

        CircuitBreaker breaker = breakers.forCall(endpoint.id());
        Callable<AgentReply> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> callExecutor.submit(() -> invoker.invoke(endpoint, taskType, inputs, callTimeout)));
        Callable<AgentReply> guarded = CircuitBreaker.decorateCallable(breaker, timed);

        try {
            AgentReply reply = guarded.call();
            if (!reply.success()) {
                return DispatchResult.failure(ErrorCode.AGENT_ERROR,
                        "Agent '" + endpoint.id() + "' reported a failure for " + taskType, reply.output());
            }
            return DispatchResult.ok(reply.output());
        } catch (CallNotPermittedException e) {
            CircuitSnapshot snapshot = breakers.snapshot(endpoint.id());
            return DispatchResult.failure(ErrorCode.CIRCUIT_OPEN, "Circuit open for endpoint '" + endpoint.id() + "'"
                    + (snapshot.retryAt() == null ? "" : ", next trial after " + snapshot.retryAt()));
        } catch (TimeoutException e) {
            return DispatchResult.failure(ErrorCode.TRANSIENT_ERROR,
                    describe(endpoint, AgentCallException.Kind.TIMEOUT));
        } catch (AgentCallException e) {
            ErrorCode code = e.getKind().isTransportFailure() ? ErrorCode.TRANSIENT_ERROR : ErrorCode.AGENT_ERROR;
            return DispatchResult.failure(code, describe(endpoint, e.getKind()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.failure(ErrorCode.TRANSIENT_ERROR, "Call to '" + endpoint.id() + "' interrupted");
        } catch (Exception e) {
            // In-process agent threw; the breaker has recorded it as a failure.
            log.warn("Agent '{}' raised {} for task_type={}", endpoint.id(), e.getClass().getSimpleName(), taskType);
            return DispatchResult.failure(ErrorCode.AGENT_ERROR,
                    "Agent '" + endpoint.id() + "' raised an unexpected error");
        }
    }

    // ------------------------------------------------------------------
    // PHI scan over the whole input tree
    // ------------------------------------------------------------------

    /** Message naming the first flagged field, or empty when every string is clean. */
    private Optional<String> findPhi(Object value) {
        return findPhi("", value);
    }

    private Optional<String> findPhi(String path, Object value) {
        if (value instanceof String text) {
            PhiScanResult scan = phiGate.scan(text);
            if (scan.flagged()) {
                List<String> types = scan.spans().stream().map(s -> s.type().name()).distinct().sorted().toList();
                return Optional.of("PHI detected in field '" + path + "'"
                        + (types.isEmpty() ? "" : " " + types));
            }
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String child = path.isEmpty() ? String.valueOf(entry.getKey()) : path + "." + entry.getKey();
                Optional<String> hit = findPhi(child, entry.getValue());
                if (hit.isPresent()) return hit;
            }
            return Optional.empty();
        }
        if (value instanceof Iterable<?> items) {
            int i = 0;
            for (Object item : items) {
                Optional<String> hit = findPhi(path + "[" + i++ + "]", item);
                if (hit.isPresent()) return hit;
            }
        }
        return Optional.empty();
    }

    private static String describe(AgentEndpoint endpoint, AgentCallException.Kind kind) {
        return switch (kind) {
            case NETWORK            -> "Agent '" + endpoint.id() + "' unreachable";
            case TIMEOUT            -> "Agent '" + endpoint.id() + "' timed out";
            case SERVER_ERROR       -> "Agent '" + endpoint.id() + "' answered with a server error";
            case REJECTED           -> "Agent '" + endpoint.id() + "' rejected the request";
            case MALFORMED_RESPONSE -> "Agent '" + endpoint.id() + "' returned a malformed reply";
        };
    }
}
