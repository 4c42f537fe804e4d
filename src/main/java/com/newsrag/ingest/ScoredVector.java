package com.newsrag.ingest;

public record ScoredVector(String documentId, float score) {
}
