package com.newsrag.inference;

import java.time.Clock;
import java.time.Duration;

import com.newsrag.resilience.CircuitBreakers;
import com.newsrag.resilience.RetryPolicy;
import com.newsrag.resilience.Sleeper;
import com.newsrag.runtime.EngineConfig;
import com.newsrag.runtime.JsonHttpClient;

import okhttp3.OkHttpClient;

public final class ChatModels {
    private ChatModels() {
    }

    public static ChatModel fromConfig(EngineConfig config, OkHttpClient httpClient, Clock clock, Sleeper sleeper) {
        EngineConfig.SynthesisConfig synthesis = config.getSynthesis();
        EngineConfig.ResilienceConfig resilience = config.getResilience();
        JsonHttpClient client = new JsonHttpClient(
                httpClient,
                synthesis.getEndpoint(),
                synthesis.resolveApiKey(),
                Duration.ofMillis(synthesis.getTimeoutMs()),
                new RetryPolicy(resilience.getMaxRetries(), resilience.getInitialBackoffMs(), resilience.getMaxBackoffMs(), sleeper),
                CircuitBreakers.consecutiveFailures("synthesis", resilience.getFailureThreshold(), Duration.ofMillis(resilience.getOpenStateMs()), clock));
        return new OpenAiChatModel(client, synthesis.getModel(), synthesis.getTemperature(), synthesis.getMaxTokens());
    }
}
