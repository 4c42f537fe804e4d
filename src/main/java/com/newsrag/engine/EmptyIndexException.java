package com.newsrag.engine;

public class EmptyIndexException extends KnowledgeEngineException {
    public EmptyIndexException() {
        super("The index contains no documents; ingest or import before searching");
    }
}
