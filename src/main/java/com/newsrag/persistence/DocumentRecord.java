package com.newsrag.persistence;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsrag.ingest.Document;

/**
 * One line of {@code documents.jsonl}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record DocumentRecord(
        @JsonProperty("id") String id,
        @JsonProperty("text") String text,
        @JsonProperty("category") String category,
        @JsonProperty("source_url") String sourceUrl,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("ingested_at") Instant ingestedAt) {

    static DocumentRecord from(Document document) {
        return new DocumentRecord(document.id(), document.text(), document.category(), document.sourceUrl(),
                document.contentHash(), document.ingestedAt());
    }

    Document toDocument() {
        return new Document(id, text, category, sourceUrl, contentHash, ingestedAt);
    }
}
