package com.newsrag.ingest;

import java.util.List;

public record IngestionReport(int submitted, int added, int duplicates, int totalDocuments, List<String> documentIds) {
}
