package com.newsrag.retrieval;

import com.newsrag.ingest.Document;

public record SearchResult(Document document, float score) {
}
