package com.newsrag.ingest;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrag.engine.ConfigurationException;
import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.runtime.JsonHttpClient;

public class OpenAiEmbeddingService implements EmbeddingService {
    private final JsonHttpClient client;
    private final String model;
    private volatile int observedDimension;

    public OpenAiEmbeddingService(JsonHttpClient client, String model) {
        if (client == null) {
            throw new ConfigurationException("Embedding provider requires an HTTP client");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("Embedding model identifier must be configured");
        }
        this.client = client;
        this.model = model;
    }

    @Override
    public float[] embed(String text) {
        JsonNode root = client.post("embedding", Map.of("model", model, "input", text));
        JsonNode vectorNode = root.path("data").path(0).path("embedding");
        if (!vectorNode.isArray()) {
            vectorNode = root.path("embedding");
        }
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new ProviderUnavailableException("embedding response carried no vector", false);
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        checkDimension(out.length);
        return out;
    }

    private synchronized void checkDimension(int length) {
        if (observedDimension == 0) {
            observedDimension = length;
        } else if (observedDimension != length) {
            throw new ProviderUnavailableException("embedding model " + model + " returned " + length
                    + " dimensions, expected " + observedDimension, false);
        }
    }

    @Override
    public int dimension() {
        return observedDimension;
    }

    @Override
    public String modelId() {
        return model;
    }
}
