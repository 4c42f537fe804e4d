package com.newsrag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Exact cosine search over an in-memory map: every vector that passes the
 * filter is scored. Persisted as a JSON array of entries.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    private final Map<String, IndexedVector> vectors = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private int dimension;

    @Override
    public void add(String documentId, float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("embedding for " + documentId + " is empty");
        }
        if (dimension == 0) {
            dimension = embedding.length;
        } else if (embedding.length != dimension) {
            throw new IllegalArgumentException("embedding for " + documentId + " has " + embedding.length
                    + " dimensions, index holds " + dimension);
        }
        vectors.put(documentId, new IndexedVector(documentId, embedding));
    }

    @Override
    public boolean remove(String documentId) {
        if (vectors.remove(documentId) == null) {
            return false;
        }
        if (vectors.isEmpty()) {
            dimension = 0;
        }
        return true;
    }

    @Override
    public List<ScoredVector> search(float[] queryEmbedding, int topK, Predicate<String> filter, Comparator<String> tieBreak) {
        if (topK <= 0) {
            return List.of();
        }
        Comparator<ScoredVector> order = Comparator.comparingDouble(ScoredVector::score).reversed()
                .thenComparing(ScoredVector::documentId, tieBreak);
        return vectors.values().stream()
                .filter(indexed -> filter.test(indexed.documentId()))
                .map(indexed -> new ScoredVector(indexed.documentId(), cosine(queryEmbedding, indexed.embedding())))
                .sorted(order)
                .limit(topK)
                .toList();
    }

    @Override
    public int size() {
        return vectors.size();
    }

    @Override
    public Set<String> documentIds() {
        return new LinkedHashSet<>(vectors.keySet());
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public LocalJsonVectorIndex copy() {
        LocalJsonVectorIndex copy = new LocalJsonVectorIndex();
        vectors.values().forEach(indexed -> copy.add(indexed.documentId(), indexed.embedding()));
        return copy;
    }

    @Override
    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        objectMapper.writeValue(path.toFile(), new ArrayList<>(vectors.values()));
    }

    public static LocalJsonVectorIndex load(Path path) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        if (!Files.exists(path)) {
            return index;
        }
        ObjectMapper mapper = new ObjectMapper();
        List<IndexedVector> loaded = mapper.readValue(path.toFile(), new TypeReference<List<IndexedVector>>() {
        });
        for (IndexedVector entry : loaded) {
            index.add(entry.documentId(), entry.embedding());
        }
        return index;
    }

    static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndexedVector(String documentId, float[] embedding) {
    }
}
