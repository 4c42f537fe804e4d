package com.newsrag.engine;

import java.util.List;
import java.util.Optional;

import com.newsrag.retrieval.CategoryRetrievalResult;
import com.newsrag.retrieval.SearchResult;

/**
 * The language-model step failed. Carries what had been retrieved so callers can
 * show fragments without prose.
 */
public class SynthesisException extends KnowledgeEngineException {
    private final List<SearchResult> fragments;
    private final CategoryRetrievalResult categoryRetrieval;

    public SynthesisException(String message, List<SearchResult> fragments, Throwable cause) {
        super(message, cause);
        this.fragments = List.copyOf(fragments);
        this.categoryRetrieval = null;
    }

    public SynthesisException(String message, CategoryRetrievalResult categoryRetrieval, Throwable cause) {
        super(message, cause);
        this.fragments = categoryRetrieval.allResults();
        this.categoryRetrieval = categoryRetrieval;
    }

    public List<SearchResult> fragments() {
        return fragments;
    }

    public Optional<CategoryRetrievalResult> categoryRetrieval() {
        return Optional.ofNullable(categoryRetrieval);
    }
}
