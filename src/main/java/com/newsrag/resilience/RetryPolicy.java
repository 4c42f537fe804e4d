package com.newsrag.resilience;

import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.engine.ProviderUnavailableException;

/**
 * Bounded retry with capped exponential backoff. Attempts are
 * {@code maxRetries + 1}; the delay before retry {@code n} is
 * {@code min(maxBackoffMs, initialBackoffMs * 2^(n-1))}.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, long initialBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        if (maxRetries < 0 || initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("retry settings must be >= 0 and maxBackoffMs >= initialBackoffMs");
        }
        this.maxRetries = maxRetries;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.sleeper = sleeper;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, 0, 0, Sleeper.SYSTEM);
    }

    public <T> T execute(String operation, Supplier<T> call, Predicate<RuntimeException> retryable) {
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                long backoff = backoffMillis(attempt);
                log.warn("retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ProviderUnavailableException(operation + " interrupted while backing off", false, e);
                }
            }
        }
    }

    long backoffMillis(int attempt) {
        long delay = initialBackoffMs;
        for (int i = 1; i < attempt && delay < maxBackoffMs; i++) {
            delay = delay * 2;
        }
        return Math.min(delay, maxBackoffMs);
    }

    public int maxRetries() {
        return maxRetries;
    }
}
