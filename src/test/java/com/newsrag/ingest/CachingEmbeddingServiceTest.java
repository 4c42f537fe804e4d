package com.newsrag.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.testing.CountingEmbeddingService;
import com.newsrag.testing.MutableClock;

class CachingEmbeddingServiceTest {

    private final MutableClock clock = new MutableClock();
    private final CountingEmbeddingService provider = new CountingEmbeddingService();

    @Test
    void shouldServeRepeatedTextFromCacheWithinTtl() {
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofMinutes(5), 10, clock);

        float[] first = cache.getOrCompute("market outlook");
        clock.advance(Duration.ofMinutes(4));
        float[] second = cache.getOrCompute("market outlook");

        assertArrayEquals(first, second);
        assertEquals(1, provider.callCount());
        assertEquals(1, cache.stats().hits());
        assertEquals(1, cache.stats().misses());
    }

    @Test
    void shouldTreatExpiredEntryAsMiss() {
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofMillis(1), 10, clock);

        cache.embed("X");
        clock.advance(Duration.ofMillis(2));
        cache.embed("X");

        assertEquals(2, provider.callCount());
        CacheStats stats = cache.stats();
        assertEquals(0, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(1, stats.expirations());
        assertEquals(1, stats.size());
    }

    @Test
    void shouldEvictLeastRecentlyUsedWhenFull() {
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofHours(1), 2, clock);

        cache.embed("alpha");
        cache.embed("beta");
        cache.embed("alpha");
        cache.embed("gamma");

        assertEquals(3, provider.callCount());
        assertEquals(1, cache.stats().evictions());

        cache.embed("alpha");
        assertEquals(3, provider.callCount());
        cache.embed("beta");
        assertEquals(4, provider.callCount());
    }

    @Test
    void shouldNotExposeCachedArrays() {
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofHours(1), 10, clock);

        float[] first = cache.embed("copy safety");
        float expected = first[0];
        first[0] = 42f;

        assertEquals(expected, cache.embed("copy safety")[0]);
    }

    @Test
    void shouldNotCacheProviderFailures() {
        provider.failAfter(0);
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofHours(1), 10, clock);

        assertThrows(ProviderUnavailableException.class, () -> cache.embed("down"));
        assertEquals(0, cache.stats().size());
        assertEquals(1, cache.stats().misses());
    }

    @Test
    void shouldClearEntriesButKeepCounters() {
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofHours(1), 10, clock);
        cache.embed("one");
        cache.clear();
        cache.embed("one");

        assertEquals(2, provider.callCount());
        assertEquals(2, cache.stats().misses());
    }

    @Test
    void shouldServeCacheHitWhileAnotherThreadWaitsOnProvider() throws Exception {
        CachingEmbeddingService cache = new CachingEmbeddingService(provider, Duration.ofHours(1), 10, clock);
        float[] warm = cache.embed("warm");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        provider.blockOn("slow", entered, release);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<float[]> slow = executor.submit(() -> cache.embed("slow"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<float[]> hit = executor.submit(() -> cache.embed("warm"));

            assertArrayEquals(warm, hit.get(5, TimeUnit.SECONDS));
            assertFalse(slow.isDone());
            release.countDown();
            assertEquals(64, slow.get(5, TimeUnit.SECONDS).length);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertEquals(2, provider.callCount());
        assertEquals(1, cache.stats().hits());
        assertEquals(2, cache.stats().size());
    }
}
