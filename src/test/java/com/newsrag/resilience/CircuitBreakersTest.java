package com.newsrag.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.testing.MutableClock;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

class CircuitBreakersTest {

    private final MutableClock clock = new MutableClock();
    private final CircuitBreaker breaker = CircuitBreakers.consecutiveFailures("embedding", 2, Duration.ofSeconds(30), clock);
    private final AtomicInteger calls = new AtomicInteger();

    @Test
    void shouldOpenAfterConsecutiveFailuresAndShortCircuit() {
        failOnce();
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        failOnce();
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());

        ProviderUnavailableException rejected = assertThrows(ProviderUnavailableException.class,
                () -> CircuitBreakers.call(breaker, this::succeed));
        assertTrue(rejected.getMessage().contains("circuit embedding is open"));
        assertFalse(rejected.retryable());
        assertEquals(2, calls.get());
    }

    @Test
    void shouldCloseAfterSuccessfulTrial() {
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(31));

        assertEquals("ok", CircuitBreakers.call(breaker, this::succeed));
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void shouldReopenWhenTrialFails() {
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(31));

        failOnce();
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertThrows(ProviderUnavailableException.class, () -> CircuitBreakers.call(breaker, this::succeed));
        assertEquals(3, calls.get());
    }

    @Test
    void shouldStayClosedWhenFailuresAreInterleavedWithSuccess() {
        failOnce();
        CircuitBreakers.call(breaker, this::succeed);
        failOnce();

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void shouldRejectNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> CircuitBreakers.consecutiveFailures("synthesis", 0, Duration.ofSeconds(1), clock));
    }

    private void failOnce() {
        assertThrows(ProviderUnavailableException.class, () -> CircuitBreakers.call(breaker, () -> {
            calls.incrementAndGet();
            throw new ProviderUnavailableException("HTTP 503", true);
        }));
    }

    private String succeed() {
        calls.incrementAndGet();
        return "ok";
    }
}
