package com.newsrag.engine;

import com.newsrag.ingest.CacheStats;

/**
 * @param activeSnapshot  name of the persisted snapshot, or null when nothing has been saved
 * @param backupComplete  the active snapshot holds every file its manifest requires, with matching sizes
 * @param unsavedChanges  the in-memory index differs from the active snapshot
 */
public record IndexStatus(
        boolean loaded,
        int documentCount,
        int vectorCount,
        String embeddingModel,
        String activeSnapshot,
        boolean backupComplete,
        boolean unsavedChanges,
        CacheStats cacheStats) {
}
