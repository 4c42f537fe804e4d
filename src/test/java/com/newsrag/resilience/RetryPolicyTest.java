package com.newsrag.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.newsrag.engine.ProviderUnavailableException;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    @Test
    void shouldRetryRetryableFailuresUntilSuccess() {
        RetryPolicy policy = new RetryPolicy(3, 100, 250, recordingSleeper);
        AtomicInteger attempts = new AtomicInteger();

        String result = policy.execute("embedding", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ProviderUnavailableException("HTTP 503", true);
            }
            return "vector";
        }, RetryPolicyTest::retryable);

        assertEquals("vector", result);
        assertEquals(3, attempts.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        RetryPolicy policy = new RetryPolicy(2, 100, 250, recordingSleeper);
        AtomicInteger attempts = new AtomicInteger();

        ProviderUnavailableException failure = assertThrows(ProviderUnavailableException.class,
                () -> policy.execute("embedding", () -> {
                    attempts.incrementAndGet();
                    throw new ProviderUnavailableException("timeout", true);
                }, RetryPolicyTest::retryable));

        assertEquals("timeout", failure.getMessage());
        assertEquals(3, attempts.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void shouldNotRetryNonRetryableFailures() {
        RetryPolicy policy = new RetryPolicy(5, 100, 250, recordingSleeper);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(ProviderUnavailableException.class, () -> policy.execute("chat", () -> {
            attempts.incrementAndGet();
            throw new ProviderUnavailableException("HTTP 401", false);
        }, RetryPolicyTest::retryable));

        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldCapExponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, 100, 250, recordingSleeper);

        assertEquals(100, policy.backoffMillis(1));
        assertEquals(200, policy.backoffMillis(2));
        assertEquals(250, policy.backoffMillis(3));
        assertEquals(250, policy.backoffMillis(10));
    }

    @Test
    void shouldAbortWhenInterruptedDuringBackoff() {
        RetryPolicy policy = new RetryPolicy(3, 100, 250, millis -> {
            throw new InterruptedException("stop");
        });

        ProviderUnavailableException failure = assertThrows(ProviderUnavailableException.class,
                () -> policy.execute("embedding", () -> {
                    throw new ProviderUnavailableException("HTTP 503", true);
                }, RetryPolicyTest::retryable));

        assertFalse(failure.retryable());
        assertTrue(Thread.interrupted());
    }

    private static boolean retryable(RuntimeException e) {
        return e instanceof ProviderUnavailableException unavailable && unavailable.retryable();
    }
}
