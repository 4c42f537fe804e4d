package com.newsrag.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Describes one persisted snapshot: the files that must be present to rebuild
 * it, and the counts they must yield when read back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexManifest(
        int formatVersion,
        String embeddingModel,
        int embeddingDimension,
        List<String> taxonomy,
        List<ManifestFile> files,
        int documentCount,
        int vectorCount,
        Instant createdAt) {

    public static final int FORMAT_VERSION = 1;

    public IndexManifest {
        taxonomy = taxonomy == null ? List.of() : List.copyOf(taxonomy);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public Optional<ManifestFile> file(String name) {
        return files.stream().filter(file -> file.name().equals(name)).findFirst();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ManifestFile(String name, long sizeBytes, String sha256) {
    }
}
