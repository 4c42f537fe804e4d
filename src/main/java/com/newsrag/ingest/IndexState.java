package com.newsrag.ingest;

import java.util.HashSet;
import java.util.Set;

/**
 * A document store and the vector index over it. Every document has exactly one
 * vector and every vector belongs to a stored document.
 */
public record IndexState(DocumentStore documents, LocalJsonVectorIndex index) {

    public static IndexState empty() {
        return new IndexState(new DocumentStore(), new LocalJsonVectorIndex());
    }

    public IndexState copy() {
        return new IndexState(documents.copy(), index.copy());
    }

    public int documentCount() {
        return documents.size();
    }

    public int vectorCount() {
        return index.size();
    }

    /**
     * @throws IllegalStateException when documents and vectors have diverged
     */
    public IndexState verifyConsistent() {
        String problem = inconsistency();
        if (problem != null) {
            throw new IllegalStateException(problem);
        }
        return this;
    }

    public String inconsistency() {
        if (documents.size() != index.size()) {
            return "document count " + documents.size() + " differs from vector count " + index.size();
        }
        Set<String> documentIds = new HashSet<>();
        documents.all().forEach(document -> documentIds.add(document.id()));
        if (!documentIds.equals(index.documentIds())) {
            return "document ids and vector ids differ";
        }
        return null;
    }
}
