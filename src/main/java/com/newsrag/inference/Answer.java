package com.newsrag.inference;

import java.util.List;

import com.newsrag.retrieval.SearchResult;

/**
 * Synthesized prose plus the fragments it was grounded on. The text is never
 * truncated here; {@code characterCount} lets the delivery side decide how to
 * split it.
 *
 * @param modelUsed false when the text was produced without calling the model
 *                  (all-categories request over categories that all lack data)
 */
public record Answer(
        String query,
        AnswerMode mode,
        String text,
        int characterCount,
        List<SearchResult> fragments,
        String contextPreview,
        List<String> categoriesWithData,
        List<String> categoriesEmpty,
        String model,
        boolean modelUsed) {

    public Answer {
        fragments = List.copyOf(fragments);
        categoriesWithData = List.copyOf(categoriesWithData);
        categoriesEmpty = List.copyOf(categoriesEmpty);
    }
}
