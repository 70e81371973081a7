package com.researchflow.orchestrator.breaker;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One resilience4j {@link CircuitBreaker} per agent endpoint, keyed by
 * endpoint id and created on first use.
 *
 * The breaker itself decides admission. This class follows its events to
 * keep what the operator view shows (consecutive failures, when the circuit
 * opened, the cooldown in force) and ends a failure streak whose last
 * failure is older than {@code failure-window}.
 *
 * Each breaker registers a gauge:
 * <pre>
 *   researchflow.breaker.state{endpoint}   0 = closed, 1 = open, 2 = half_open
 * </pre>
 */
@Component
public class AgentCircuitBreakers {

    private static final Logger log = LoggerFactory.getLogger(AgentCircuitBreakers.class);

    private final Map<String, Tracked> breakers = new ConcurrentHashMap<>();

    private final CircuitBreakerRegistry registry;
    private final Duration               failureWindow;
    private final Duration               baseCooldown;
    private final IntervalFunction       cooldowns;
    private final Clock                  clock;
    private final MeterRegistry          meterRegistry;

    @Autowired
    public AgentCircuitBreakers(CircuitBreakerRegistry registry,
                                ResearchFlowProperties properties,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this(registry, properties.getBreaker(), clock, meterRegistry);
    }

    public AgentCircuitBreakers(ResearchFlowProperties.Breaker settings, Clock clock, MeterRegistry meterRegistry) {
        this(CircuitBreakerRegistry.of(ResilienceConfig.agentBreakerConfig(settings)), settings, clock, meterRegistry);
    }

    private AgentCircuitBreakers(CircuitBreakerRegistry registry,
                                 ResearchFlowProperties.Breaker settings,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.failureWindow = settings.getFailureWindow();
        this.baseCooldown  = settings.getCooldown();
        this.cooldowns     = registry.getDefaultConfig().getWaitIntervalFunctionInOpenState();
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    /** The endpoint's breaker, without any bookkeeping. */
    public CircuitBreaker forEndpoint(String endpointId) {
        return tracked(endpointId).breaker;
    }

    /**
     * The endpoint's breaker, ready to guard a new call. A closed breaker
     * whose failure streak went quiet for longer than the failure window
     * starts over.
     */
    public CircuitBreaker forCall(String endpointId) {
        Tracked t = tracked(endpointId);
        Instant lastFailure = t.lastFailureAt;
        if (t.breaker.getState() == CircuitBreaker.State.CLOSED
                && t.consecutiveFailures.get() > 0
                && lastFailure != null
                && Duration.between(lastFailure, clock.instant()).compareTo(failureWindow) > 0) {
            log.debug("Circuit '{}' failure streak expired", endpointId);
            t.breaker.reset();
        }
        return t.breaker;
    }

    public CircuitSnapshot snapshot(String endpointId) {
        return tracked(endpointId).snapshot();
    }

    /** Current state of every breaker created so far, sorted by endpoint id. */
    public Map<String, CircuitSnapshot> snapshots() {
        Map<String, CircuitSnapshot> result = new TreeMap<>();
        breakers.forEach((id, t) -> result.put(id, t.snapshot()));
        return result;
    }

    // ------------------------------------------------------------------
    // Creation and event tracking
    // ------------------------------------------------------------------

    private Tracked tracked(String endpointId) {
        return breakers.computeIfAbsent(endpointId, this::create);
    }

    private Tracked create(String endpointId) {
        Tracked t = new Tracked(registry.circuitBreaker(endpointId));
        t.cooldown = baseCooldown;

        t.breaker.getEventPublisher()
                .onError(e -> {
                    t.consecutiveFailures.incrementAndGet();
                    t.lastFailureAt = clock.instant();
                })
                .onSuccess(e -> t.consecutiveFailures.set(0))
                .onReset(e -> t.closed(baseCooldown))
                .onStateTransition(e -> {
                    CircuitBreaker.State from = e.getStateTransition().getFromState();
                    CircuitBreaker.State to   = e.getStateTransition().getToState();
                    switch (to) {
                        case OPEN -> {
                            int openings = from == CircuitBreaker.State.HALF_OPEN ? t.openings.incrementAndGet() : 1;
                            t.openings.set(openings);
                            t.cooldown = Duration.ofMillis(cooldowns.apply(openings));
                            t.openedAt = clock.instant();
                            log.warn("Circuit '{}' OPEN after {} failures, cooling down for {}",
                                    endpointId, t.consecutiveFailures.get(), t.cooldown);
                        }
                        case HALF_OPEN -> log.info("Circuit '{}' half-open, admitting one trial call", endpointId);
                        case CLOSED -> {
                            t.closed(baseCooldown);
                            log.info("Circuit '{}' closed after successful trial call", endpointId);
                        }
                        default -> log.info("Circuit '{}' moved to {}", endpointId, to);
                    }
                });

        Gauge.builder("researchflow.breaker.state", t, x -> CircuitState.of(x.breaker.getState()).ordinal())
                .description("Circuit breaker state per agent endpoint")
                .tag("endpoint", endpointId)
                .register(meterRegistry);
        return t;
    }

    private static final class Tracked {
        final CircuitBreaker breaker;
        final AtomicInteger  consecutiveFailures = new AtomicInteger();
        final AtomicInteger  openings            = new AtomicInteger();
        volatile Instant     lastFailureAt;
        volatile Instant     openedAt;
        volatile Duration    cooldown;

        Tracked(CircuitBreaker breaker) {
            this.breaker = breaker;
        }

        void closed(Duration baseCooldown) {
            consecutiveFailures.set(0);
            openings.set(0);
            openedAt = null;
            cooldown = baseCooldown;
        }

        CircuitSnapshot snapshot() {
            CircuitState state = CircuitState.of(breaker.getState());
            return new CircuitSnapshot(state, consecutiveFailures.get(),
                    state == CircuitState.CLOSED ? null : openedAt, cooldown, lastFailureAt);
        }
    }
}
