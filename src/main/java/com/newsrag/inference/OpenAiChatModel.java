package com.newsrag.inference;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrag.engine.ConfigurationException;
import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.runtime.JsonHttpClient;

public class OpenAiChatModel implements ChatModel {
    private final JsonHttpClient client;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiChatModel(JsonHttpClient client, String model, double temperature, int maxTokens) {
        if (client == null) {
            throw new ConfigurationException("Chat model requires an HTTP client");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("Chat model identifier must be configured");
        }
        this.client = client;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String complete(List<ChatMessage> messages) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", messages);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);

        JsonNode root = client.post("chat", payload);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderUnavailableException("chat response carried no message content", false);
        }
        return content.asText();
    }

    @Override
    public String modelId() {
        return model;
    }
}
