package com.newsrag.persistence;

import java.util.List;

/**
 * Identity of the vector space a snapshot was built in.
 */
public record SnapshotDescriptor(String embeddingModel, List<String> taxonomy) {
    public SnapshotDescriptor {
        taxonomy = List.copyOf(taxonomy);
    }
}
