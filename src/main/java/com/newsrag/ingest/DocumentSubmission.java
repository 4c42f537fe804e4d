package com.newsrag.ingest;

/**
 * What an ingestor hands over. The engine computes the content hash itself.
 */
public record DocumentSubmission(String text, String category, String sourceUrl) {
    public DocumentSubmission {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Document text must not be blank");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Document category must not be blank");
        }
    }
}
