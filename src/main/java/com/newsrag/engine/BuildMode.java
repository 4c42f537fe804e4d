package com.newsrag.engine;

public enum BuildMode {
    /** The batch replaces the whole corpus. */
    FULL,
    /** The batch is added to the existing corpus. */
    INCREMENTAL
}
