package com.newsrag.ingest;

import java.time.Instant;

public record Document(
        String id,
        String text,
        String category,
        String sourceUrl,
        String contentHash,
        Instant ingestedAt) {

    /**
     * Text handed to the embedding model: the category tag is part of the signal.
     */
    public String embeddingInput() {
        return "[" + category + "] " + text;
    }
}
