package com.newsrag.ingest;

public interface EmbeddingService {
    float[] embed(String text);

    /**
     * Expected vector length, or 0 when the remote model decides it.
     */
    int dimension();

    String modelId();
}
