package com.newsrag.engine;

/**
 * Missing or invalid credentials, model identifiers or limits. Raised while the
 * engine and its providers are being constructed.
 */
public class ConfigurationException extends KnowledgeEngineException {
    public ConfigurationException(String message) {
        super(message);
    }
}
