package com.newsrag.retrieval;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

import com.newsrag.engine.EmptyIndexException;
import com.newsrag.ingest.Document;
import com.newsrag.ingest.DocumentStore;
import com.newsrag.ingest.EmbeddingService;
import com.newsrag.ingest.IndexState;

public class RetrievalService {
    private final EmbeddingService embeddingService;

    public RetrievalService(EmbeddingService embeddingService) {
        this.embeddingService = embeddingService;
    }

    /**
     * Global top-k over the whole corpus.
     *
     * @throws EmptyIndexException when the state holds no documents
     */
    public List<SearchResult> search(IndexState state, String query, int topK) {
        requireQuery(query);
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        if (state.documents().isEmpty()) {
            throw new EmptyIndexException();
        }
        return rank(state, embedQuery(query), topK, id -> true);
    }

    public float[] embedQuery(String query) {
        requireQuery(query);
        return embeddingService.embed(query.strip());
    }

    List<SearchResult> rank(IndexState state, float[] queryEmbedding, int topK, Predicate<String> filter) {
        DocumentStore documents = state.documents();
        return state.index().search(queryEmbedding, topK, filter, newestFirst(documents)).stream()
                .map(scored -> new SearchResult(
                        documents.get(scored.documentId()).orElseThrow(() -> new IllegalStateException(
                                "vector " + scored.documentId() + " has no document")),
                        scored.score()))
                .toList();
    }

    /**
     * Equal scores: most recently ingested first, then by id.
     */
    static Comparator<String> newestFirst(DocumentStore documents) {
        Comparator<String> byIngestedAt = Comparator.comparing(
                (String id) -> documents.get(id).map(Document::ingestedAt).orElse(Instant.EPOCH),
                Comparator.reverseOrder());
        return byIngestedAt.thenComparing(Comparator.naturalOrder());
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
    }
}
