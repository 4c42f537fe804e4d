package com.newsrag.engine;

/**
 * A backup bundle failed validation. The active index was not touched.
 */
public class ImportRejectedException extends KnowledgeEngineException {
    public ImportRejectedException(String message) {
        super(message);
    }

    public ImportRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
