package com.newsrag.ingest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ingested documents keyed by id, with a content-hash index that makes
 * re-ingesting identical text a no-op. Not synchronised; the engine guards it.
 */
public class DocumentStore {
    private final Map<String, Document> documentsById = new LinkedHashMap<>();
    private final Map<String, String> idsByContentHash = new LinkedHashMap<>();

    public DocumentStore() {
    }

    public DocumentStore(Collection<Document> documents) {
        documents.forEach(this::add);
    }

    public DocumentStore copy() {
        return new DocumentStore(documentsById.values());
    }

    public Optional<String> idForContentHash(String contentHash) {
        return Optional.ofNullable(idsByContentHash.get(contentHash));
    }

    /**
     * Adds the document unless its content hash is already present.
     *
     * @return true when the document was added
     */
    public boolean add(Document document) {
        if (idsByContentHash.containsKey(document.contentHash())) {
            return false;
        }
        if (documentsById.containsKey(document.id())) {
            throw new IllegalStateException("Document id collision for " + document.id());
        }
        documentsById.put(document.id(), document);
        idsByContentHash.put(document.contentHash(), document.id());
        return true;
    }

    public Optional<Document> remove(String id) {
        Document removed = documentsById.remove(id);
        if (removed != null) {
            idsByContentHash.remove(removed.contentHash());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Document> get(String id) {
        return Optional.ofNullable(documentsById.get(id));
    }

    public List<Document> byCategory(String category) {
        return documentsById.values().stream()
                .filter(document -> document.category().equals(category))
                .toList();
    }

    public List<Document> all() {
        return new ArrayList<>(documentsById.values());
    }

    public int size() {
        return documentsById.size();
    }

    public boolean isEmpty() {
        return documentsById.isEmpty();
    }
}
