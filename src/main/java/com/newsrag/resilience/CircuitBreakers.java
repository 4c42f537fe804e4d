package com.newsrag.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.engine.ProviderUnavailableException;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;

/**
 * Circuit breakers for the model endpoints. A breaker opens once the last
 * {@code failureThreshold} calls have all failed, rejects calls for
 * {@code openState}, then lets a single trial call decide whether to close.
 */
public final class CircuitBreakers {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakers.class);

    private CircuitBreakers() {
    }

    public static CircuitBreaker consecutiveFailures(String name, int failureThreshold, Duration openState, Clock clock) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(openState)
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
        CircuitBreaker breaker = new CircuitBreakerStateMachine(name, config, clock);
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("circuit.transition name={} transition={}", name, event.getStateTransition()));
        return breaker;
    }

    /**
     * Runs the call through the breaker. A rejected call surfaces as a
     * non-retryable {@link ProviderUnavailableException}.
     */
    public static <T> T call(CircuitBreaker breaker, Supplier<T> supplier) {
        try {
            return breaker.executeSupplier(supplier);
        } catch (CallNotPermittedException e) {
            throw new ProviderUnavailableException("circuit " + breaker.getName() + " is open", false, e);
        }
    }
}
