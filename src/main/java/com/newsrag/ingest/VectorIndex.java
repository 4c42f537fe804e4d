package com.newsrag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

public interface VectorIndex {
    void add(String documentId, float[] embedding);

    boolean remove(String documentId);

    /**
     * Top {@code topK} ids accepted by {@code filter}, by descending cosine
     * similarity; equal scores are ordered by {@code tieBreak} over ids.
     */
    List<ScoredVector> search(float[] queryEmbedding, int topK, Predicate<String> filter, Comparator<String> tieBreak);

    int size();

    Set<String> documentIds();

    VectorIndex copy();

    void save(Path path) throws IOException;
}
