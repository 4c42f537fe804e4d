package com.newsrag.backup;

import java.nio.file.Path;

import com.newsrag.persistence.IndexManifest;

public record BackupBundle(Path path, long sizeBytes, IndexManifest manifest) {
}
