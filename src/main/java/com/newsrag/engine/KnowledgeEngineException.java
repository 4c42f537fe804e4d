package com.newsrag.engine;

public class KnowledgeEngineException extends RuntimeException {
    public KnowledgeEngineException(String message) {
        super(message);
    }

    public KnowledgeEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
