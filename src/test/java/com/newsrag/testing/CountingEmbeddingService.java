package com.newsrag.testing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.ingest.EmbeddingService;
import com.newsrag.ingest.HashingEmbeddingService;

/**
 * Hashing embeddings that record every provider call, optionally failing once
 * a call budget is used up or parking callers on a latch for chosen texts.
 */
public class CountingEmbeddingService implements EmbeddingService {
    private final EmbeddingService delegate;
    private final List<String> calls = new ArrayList<>();
    private final Map<String, Gate> gates = new HashMap<>();
    private int failAfterCalls = Integer.MAX_VALUE;

    public CountingEmbeddingService() {
        this(new HashingEmbeddingService(64));
    }

    public CountingEmbeddingService(EmbeddingService delegate) {
        this.delegate = delegate;
    }

    public synchronized void failAfter(int successfulCalls) {
        this.failAfterCalls = successfulCalls;
    }

    /**
     * Calls for {@code text} count down {@code entered} and then wait for
     * {@code release} before returning.
     */
    public synchronized void blockOn(String text, CountDownLatch entered, CountDownLatch release) {
        gates.put(text, new Gate(entered, release));
    }

    @Override
    public float[] embed(String text) {
        Gate gate;
        synchronized (this) {
            if (calls.size() >= failAfterCalls) {
                throw new ProviderUnavailableException("embedding provider down", true);
            }
            calls.add(text);
            gate = gates.get(text);
        }
        if (gate != null) {
            gate.entered().countDown();
            try {
                if (!gate.release().await(10, TimeUnit.SECONDS)) {
                    throw new ProviderUnavailableException("embedding call for '" + text + "' never released", false);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderUnavailableException("interrupted while embedding '" + text + "'", false);
            }
        }
        return delegate.embed(text);
    }

    public synchronized int callCount() {
        return calls.size();
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    private record Gate(CountDownLatch entered, CountDownLatch release) {
    }
}
