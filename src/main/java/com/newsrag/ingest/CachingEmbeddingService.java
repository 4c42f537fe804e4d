package com.newsrag.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes a provider by exact text, bounded by capacity (least recently used
 * goes first) and by age (entries older than the TTL are treated as absent).
 *
 * <p>The lock is held only to look up or store an entry, never while the
 * provider is being called. Two threads missing on the same text may both call
 * the provider; the later store wins.</p>
 */
public class CachingEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingService.class);

    private final EmbeddingService delegate;
    private final Duration ttl;
    private final int capacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public CachingEmbeddingService(EmbeddingService delegate, Duration ttl, int capacity, Clock clock) {
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.ttl = ttl;
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public float[] embed(String text) {
        return getOrCompute(text);
    }

    public float[] getOrCompute(String text) {
        String key = ContentHasher.sha256(delegate.modelId() + "\u0000" + text);

        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry entry = entries.get(key);
            if (entry != null) {
                if (!isExpired(entry, now)) {
                    entry.lastAccessedAt = now;
                    hits.incrementAndGet();
                    log.debug("embedding.cache.hit size={}", entries.size());
                    return entry.vector.clone();
                }
                entries.remove(key);
                expirations.incrementAndGet();
            }
            misses.incrementAndGet();
        } finally {
            lock.unlock();
        }

        float[] computed = delegate.embed(text);

        lock.lock();
        try {
            Instant storedAt = clock.instant();
            entries.put(key, new CacheEntry(computed.clone(), storedAt));
            evictOverflow();
            log.debug("embedding.cache.miss size={}", entries.size());
        } finally {
            lock.unlock();
        }
        return computed;
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return !now.isBefore(entry.createdAt.plus(ttl));
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
        while (entries.size() > capacity && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
            evictions.incrementAndGet();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hits.get(), misses.get(), evictions.get(), expirations.get(), entries.size(), capacity);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    private static final class CacheEntry {
        private final float[] vector;
        private final Instant createdAt;
        private Instant lastAccessedAt;

        private CacheEntry(float[] vector, Instant createdAt) {
            this.vector = vector;
            this.createdAt = createdAt;
            this.lastAccessedAt = createdAt;
        }
    }
}
