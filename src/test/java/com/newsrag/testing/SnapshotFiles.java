package com.newsrag.testing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsrag.ingest.ContentHasher;
import com.newsrag.persistence.IndexManifest;
import com.newsrag.persistence.PersistenceManager;

/**
 * Edits a written snapshot in place for corruption tests.
 */
public final class SnapshotFiles {
    private SnapshotFiles() {
    }

    /**
     * Rewrites the second document line to reuse the first id, then refreshes the
     * manifest so only the document contents are inconsistent.
     */
    public static void repeatFirstDocumentId(PersistenceManager manager, Path snapshot) throws IOException {
        Path documentsFile = snapshot.resolve(PersistenceManager.DOCUMENTS);
        List<String> lines = Files.readAllLines(documentsFile, StandardCharsets.UTF_8);
        String firstId = manager.mapper().readTree(lines.get(0)).get("id").asText();
        ObjectNode second = (ObjectNode) manager.mapper().readTree(lines.get(1));
        second.put("id", firstId);
        Files.write(documentsFile, List.of(lines.get(0), manager.mapper().writeValueAsString(second)), StandardCharsets.UTF_8);

        IndexManifest manifest = manager.readManifest(snapshot);
        List<IndexManifest.ManifestFile> files = new ArrayList<>();
        for (IndexManifest.ManifestFile file : manifest.files()) {
            Path path = snapshot.resolve(file.name());
            files.add(new IndexManifest.ManifestFile(file.name(), Files.size(path), ContentHasher.sha256(path)));
        }
        IndexManifest refreshed = new IndexManifest(manifest.formatVersion(), manifest.embeddingModel(),
                manifest.embeddingDimension(), manifest.taxonomy(), files, manifest.documentCount(),
                manifest.vectorCount(), manifest.createdAt());
        manager.mapper().writeValue(snapshot.resolve(PersistenceManager.MANIFEST).toFile(), refreshed);
    }
}
