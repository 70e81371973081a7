package com.researchflow.orchestrator.config;

import com.researchflow.orchestrator.agent.AgentCallException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breakers and the per-call time limit for agent endpoints.
 *
 * A breaker opens once its last {@code failure-threshold} recorded calls all
 * failed, i.e. after that many consecutive transport failures. Each reopening
 * from HALF_OPEN multiplies the cooldown, capped at {@code max-cooldown}.
 */
@Configuration
public class ResilienceConfig {

    public static final String AGENT_CALL = "agent-call";

    @Bean
    public CircuitBreakerRegistry agentCircuitBreakerRegistry(ResearchFlowProperties properties) {
        return CircuitBreakerRegistry.of(agentBreakerConfig(properties.getBreaker()));
    }

    @Bean
    public TimeLimiter agentCallTimeLimiter(ResearchFlowProperties properties) {
        return agentTimeLimiter(properties.getDispatch());
    }

    public static CircuitBreakerConfig agentBreakerConfig(ResearchFlowProperties.Breaker settings) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailureThreshold())
                .minimumNumberOfCalls(settings.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitIntervalFunctionInOpenState(IntervalFunction.ofExponentialBackoff(
                        settings.getCooldown(), settings.getCooldownMultiplier(), settings.getMaxCooldown()))
                .recordException(ResilienceConfig::isTransportFailure)
                .build();
    }

    public static TimeLimiter agentTimeLimiter(ResearchFlowProperties.Dispatch settings) {
        return TimeLimiter.of(AGENT_CALL, TimeLimiterConfig.custom()
                .timeoutDuration(settings.getCallTimeout())
                .cancelRunningFuture(true)
                .build());
    }

    /**
     * Only an unresponsive endpoint counts against its breaker. An agent that
     * answered with an error it chose (4xx, malformed body) is responsive;
     * timeouts and in-process agent crashes are not.
     */
    static boolean isTransportFailure(Throwable t) {
        if (t instanceof AgentCallException e) {
            return e.getKind().isTransportFailure();
        }
        return true;
    }
}
