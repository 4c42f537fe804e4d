package com.newsrag.persistence;

import java.nio.file.Path;

import com.newsrag.ingest.IndexState;

public record LoadedIndex(IndexState state, IndexManifest manifest, Path snapshotDirectory) {
}
