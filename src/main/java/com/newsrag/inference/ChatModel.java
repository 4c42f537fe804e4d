package com.newsrag.inference;

import java.util.List;

public interface ChatModel {
    /**
     * Single completion over the given conversation.
     *
     * @throws com.newsrag.engine.ProviderUnavailableException when the model cannot be reached
     */
    String complete(List<ChatMessage> messages);

    String modelId();
}
