package com.newsrag.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsrag.engine.ConfigurationException;
import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.resilience.CircuitBreakers;
import com.newsrag.resilience.RetryPolicy;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Posts JSON to a model endpoint with a bearer token, a hard call timeout,
 * bounded retries and a circuit breaker. Every failure surfaces as
 * {@link ProviderUnavailableException}.
 */
public class JsonHttpClient {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;

    public JsonHttpClient(
            OkHttpClient httpClient,
            String endpoint,
            String apiKey,
            Duration timeout,
            RetryPolicy retryPolicy,
            CircuitBreaker circuitBreaker) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("Model endpoint must be configured");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("No API key configured for " + endpoint);
        }
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient").newBuilder()
                .callTimeout(timeout)
                .build();
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode post(String operation, Object payload) {
        return retryPolicy.execute(operation,
                () -> CircuitBreakers.call(circuitBreaker, () -> postOnce(operation, payload)),
                JsonHttpClient::isRetryable);
    }

    private JsonNode postOnce(String operation, Object payload) {
        try {
            String body = mapper.writeValueAsString(payload);
            Request request = new Request.Builder()
                    .url(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(body, JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful()) {
                    throw statusFailure(operation, response.code());
                }
                if (responseBody == null) {
                    throw new ProviderUnavailableException(operation + " returned an empty body", true);
                }
                return mapper.readTree(responseBody.string());
            }
        } catch (IOException e) {
            throw new ProviderUnavailableException(operation + " failed: " + e.getMessage(), true, e);
        }
    }

    private static ProviderUnavailableException statusFailure(String operation, int code) {
        if (code == 401 || code == 403) {
            return new ProviderUnavailableException(operation + " rejected credentials (HTTP " + code + ")", false);
        }
        if (code == 429) {
            return new ProviderUnavailableException(operation + " rate limited (HTTP 429)", true);
        }
        boolean retryable = code >= 500;
        return new ProviderUnavailableException(operation + " failed with HTTP " + code, retryable);
    }

    private static boolean isRetryable(RuntimeException e) {
        return e instanceof ProviderUnavailableException unavailable && unavailable.retryable();
    }
}
