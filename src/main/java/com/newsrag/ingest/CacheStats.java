package com.newsrag.ingest;

public record CacheStats(long hits, long misses, long evictions, long expirations, int size, int capacity) {
}
