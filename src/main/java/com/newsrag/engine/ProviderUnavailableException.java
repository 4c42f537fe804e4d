package com.newsrag.engine;

/**
 * An external model call (embedding or chat) could not complete: timeout,
 * rejected credentials, rate limit, open circuit or a malformed reply.
 */
public class ProviderUnavailableException extends KnowledgeEngineException {
    private final boolean retryable;

    public ProviderUnavailableException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProviderUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
