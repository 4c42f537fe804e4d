package com.newsrag.ingest;

import java.time.Clock;
import java.time.Duration;

import com.newsrag.resilience.CircuitBreakers;
import com.newsrag.resilience.RetryPolicy;
import com.newsrag.resilience.Sleeper;
import com.newsrag.runtime.EngineConfig;
import com.newsrag.runtime.JsonHttpClient;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    /**
     * Builds the provider named by {@code embedding.strategy}. Missing credentials
     * fail here rather than on the first query.
     */
    public static EmbeddingService fromConfig(EngineConfig config, OkHttpClient httpClient, Clock clock, Sleeper sleeper) {
        EngineConfig.EmbeddingConfig embedding = config.getEmbedding();
        if (embedding.getStrategy() == EngineConfig.EmbeddingStrategy.HASHING) {
            return new HashingEmbeddingService(embedding.getDimension());
        }
        EngineConfig.ResilienceConfig resilience = config.getResilience();
        JsonHttpClient client = new JsonHttpClient(
                httpClient,
                embedding.getEndpoint(),
                embedding.resolveApiKey(),
                Duration.ofMillis(embedding.getTimeoutMs()),
                new RetryPolicy(resilience.getMaxRetries(), resilience.getInitialBackoffMs(), resilience.getMaxBackoffMs(), sleeper),
                CircuitBreakers.consecutiveFailures("embedding", resilience.getFailureThreshold(), Duration.ofMillis(resilience.getOpenStateMs()), clock));
        return new OpenAiEmbeddingService(client, embedding.getModel());
    }
}
