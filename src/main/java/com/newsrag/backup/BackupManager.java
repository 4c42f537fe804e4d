package com.newsrag.backup;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.engine.EmptyIndexException;
import com.newsrag.engine.ImportRejectedException;
import com.newsrag.ingest.Document;
import com.newsrag.persistence.CorruptIndexException;
import com.newsrag.persistence.IndexManifest;
import com.newsrag.persistence.LoadedIndex;
import com.newsrag.persistence.PersistenceManager;
import com.newsrag.persistence.SnapshotDescriptor;

/**
 * Zips the active snapshot into a single portable file and restores such files.
 * An import is fully validated in a staging directory before the active
 * snapshot pointer moves; a rejected bundle leaves the active index untouched.
 */
public class BackupManager {
    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    private final PersistenceManager persistenceManager;
    private final long maxBundleBytes;

    public BackupManager(PersistenceManager persistenceManager, long maxBundleBytes) {
        if (maxBundleBytes <= 0) {
            throw new IllegalArgumentException("maxBundleBytes must be > 0");
        }
        this.persistenceManager = persistenceManager;
        this.maxBundleBytes = maxBundleBytes;
    }

    public long maxBundleBytes() {
        return maxBundleBytes;
    }

    /**
     * @throws EmptyIndexException when nothing has been persisted yet
     * @throws CorruptIndexException when the active snapshot no longer matches its manifest
     */
    public BackupBundle export(Path bundle) throws IOException {
        Path snapshot = persistenceManager.activeSnapshot().orElseThrow(EmptyIndexException::new);
        IndexManifest manifest = persistenceManager.verifyFiles(snapshot);

        if (bundle.toAbsolutePath().getParent() != null) {
            Files.createDirectories(bundle.toAbsolutePath().getParent());
        }
        Path tmp = bundle.resolveSibling(bundle.getFileName().toString() + ".tmp");
        try {
            try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(tmp))) {
                addEntry(zip, snapshot, PersistenceManager.MANIFEST);
                for (IndexManifest.ManifestFile file : manifest.files()) {
                    addEntry(zip, snapshot, file.name());
                }
            }
            Files.move(tmp, bundle, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        long size = Files.size(bundle);
        log.info("backup.export.completed bundle={} bytes={} documents={}", bundle, size, manifest.documentCount());
        return new BackupBundle(bundle, size, manifest);
    }

    /**
     * Validates the bundle and, when it is acceptable, makes it the active
     * snapshot.
     *
     * @param expected the vector space the running engine serves; a bundle built
     *                 with another embedding model or with categories outside the
     *                 taxonomy is rejected
     * @throws ImportRejectedException when the bundle fails any check
     */
    public LoadedIndex importBundle(Path bundle, SnapshotDescriptor expected) throws IOException {
        if (!Files.isRegularFile(bundle)) {
            throw reject("Bundle " + bundle + " does not exist");
        }
        long size = Files.size(bundle);
        if (size > maxBundleBytes) {
            throw reject("Bundle is " + size + " bytes, limit is " + maxBundleBytes);
        }

        Path staging = persistenceManager.newStagingDirectory();
        boolean activated = false;
        try {
            IndexManifest manifest = extract(bundle, staging);
            checkCompatible(manifest, expected);

            LoadedIndex verified;
            try {
                verified = persistenceManager.readSnapshot(staging);
            } catch (CorruptIndexException e) {
                throw reject("Bundle contents do not match its manifest: " + e.getMessage(), e);
            }
            for (Document document : verified.state().documents().all()) {
                if (!expected.taxonomy().contains(document.category())) {
                    throw reject("Bundle holds a document in unknown category " + document.category());
                }
            }

            LoadedIndex activatedIndex = persistenceManager.activate(staging);
            activated = true;
            log.info("backup.import.completed bundle={} snapshot={} documents={} vectors={}",
                    bundle, activatedIndex.snapshotDirectory().getFileName(),
                    manifest.documentCount(), manifest.vectorCount());
            return activatedIndex;
        } catch (ImportRejectedException e) {
            log.warn("backup.import.rejected bundle={} reason={}", bundle, e.getMessage());
            throw e;
        } finally {
            if (!activated) {
                PersistenceManager.discard(staging);
            }
        }
    }

    private IndexManifest extract(Path bundle, Path staging) throws IOException {
        try (ZipFile zip = new ZipFile(bundle.toFile())) {
            ZipEntry manifestEntry = zip.getEntry(PersistenceManager.MANIFEST);
            if (manifestEntry == null) {
                throw reject("Bundle has no " + PersistenceManager.MANIFEST);
            }
            copyEntry(zip, manifestEntry, staging, maxBundleBytes);
            IndexManifest manifest;
            try {
                manifest = persistenceManager.readManifest(staging);
            } catch (CorruptIndexException e) {
                throw reject("Bundle manifest is unreadable", e);
            }

            Set<String> declared = new HashSet<>();
            declared.add(PersistenceManager.MANIFEST);
            long declaredBytes = 0;
            for (IndexManifest.ManifestFile file : manifest.files()) {
                requireSafeName(file.name());
                declared.add(file.name());
                declaredBytes += Math.max(0, file.sizeBytes());
            }
            for (String required : PersistenceManager.REQUIRED_FILES) {
                if (!declared.contains(required)) {
                    throw reject("Bundle manifest does not declare required file " + required);
                }
            }
            if (declaredBytes > maxBundleBytes) {
                throw reject("Bundle declares " + declaredBytes + " bytes of content, limit is " + maxBundleBytes);
            }

            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                String name = entries.nextElement().getName();
                if (!declared.contains(name)) {
                    throw reject("Bundle contains undeclared entry " + name);
                }
            }
            for (IndexManifest.ManifestFile file : manifest.files()) {
                ZipEntry entry = zip.getEntry(file.name());
                if (entry == null) {
                    throw reject("Bundle is missing declared file " + file.name());
                }
                long copied = copyEntry(zip, entry, staging, file.sizeBytes());
                if (copied != file.sizeBytes()) {
                    throw reject("Declared file " + file.name() + " has " + copied + " bytes, manifest says "
                            + file.sizeBytes());
                }
            }
            return manifest;
        } catch (ZipException e) {
            throw reject("Bundle is not a readable archive", e);
        }
    }

    private static void checkCompatible(IndexManifest manifest, SnapshotDescriptor expected) {
        if (!expected.embeddingModel().equals(manifest.embeddingModel())) {
            throw reject("Bundle was built with embedding model " + manifest.embeddingModel()
                    + ", this engine uses " + expected.embeddingModel());
        }
        if (manifest.documentCount() != manifest.vectorCount()) {
            throw reject("Bundle declares " + manifest.documentCount() + " documents but "
                    + manifest.vectorCount() + " vectors");
        }
    }

    /**
     * Copies at most {@code limit + 1} bytes so an entry lying about its size
     * cannot fill the disk.
     */
    private static long copyEntry(ZipFile zip, ZipEntry entry, Path directory, long limit) throws IOException {
        requireSafeName(entry.getName());
        Path target = directory.resolve(entry.getName());
        long copied = 0;
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = zip.getInputStream(entry); OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                copied += read;
                if (copied > limit) {
                    throw reject("Entry " + entry.getName() + " exceeds its declared size");
                }
                out.write(buffer, 0, read);
            }
        }
        return copied;
    }

    private static void requireSafeName(String name) {
        if (name == null || name.isBlank() || name.contains("/") || name.contains("\\") || name.equals("..")
                || name.equals(".")) {
            throw reject("Bundle entry name '" + name + "' is not allowed");
        }
    }

    private static void addEntry(ZipOutputStream zip, Path directory, String name) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        Files.copy(directory.resolve(name), zip);
        zip.closeEntry();
    }

    private static ImportRejectedException reject(String message) {
        return new ImportRejectedException(message);
    }

    private static ImportRejectedException reject(String message, Throwable cause) {
        return new ImportRejectedException(message, cause);
    }

    static List<String> entryNames(Path bundle) throws IOException {
        try (ZipFile zip = new ZipFile(bundle.toFile())) {
            return zip.stream().map(ZipEntry::getName).toList();
        }
    }
}
