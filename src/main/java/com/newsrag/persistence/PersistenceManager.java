package com.newsrag.persistence;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.newsrag.ingest.ContentHasher;
import com.newsrag.ingest.Document;
import com.newsrag.ingest.DocumentStore;
import com.newsrag.ingest.IndexState;
import com.newsrag.ingest.LocalJsonVectorIndex;

/**
 * Snapshots live in their own directories under the root. A {@code CURRENT}
 * file names the active one and is only ever replaced by an atomic rename, so
 * a reader resolves either the previous snapshot or the new one in full.
 *
 * <pre>
 * root/
 *   CURRENT                      -> "snapshot-0001712345678901-1a2b3c4d"
 *   snapshot-0001712345678901-1a2b3c4d/
 *     manifest.json
 *     vectors.json
 *     documents.jsonl
 * </pre>
 */
public class PersistenceManager {
    private static final Logger log = LoggerFactory.getLogger(PersistenceManager.class);

    public static final String CURRENT = "CURRENT";
    public static final String MANIFEST = "manifest.json";
    public static final String VECTORS = "vectors.json";
    public static final String DOCUMENTS = "documents.jsonl";
    public static final List<String> REQUIRED_FILES = List.of(VECTORS, DOCUMENTS);

    static final String SNAPSHOT_PREFIX = "snapshot-";
    static final String STAGING_PREFIX = ".staging-";

    private final Path root;
    private final int retainedSnapshots;
    private final Clock clock;
    private final ObjectMapper mapper;

    public PersistenceManager(Path root, int retainedSnapshots, Clock clock) {
        this.root = root;
        this.retainedSnapshots = Math.max(0, retainedSnapshots);
        this.clock = clock;
        this.mapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public Path root() {
        return root;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Writes the state to a fresh snapshot directory and makes it the active one.
     * If anything fails before the pointer swap, the previously active snapshot
     * stays active and the partial directory is removed.
     */
    public Path save(IndexState state, SnapshotDescriptor descriptor) throws IOException {
        String problem = state.inconsistency();
        if (problem != null) {
            throw new IllegalStateException("Refusing to persist an inconsistent index: " + problem);
        }
        Files.createDirectories(root);
        Path staging = newStagingDirectory();
        boolean activated = false;
        try {
            writeVectors(state.index(), staging.resolve(VECTORS));
            writeDocuments(state.documents().all(), staging.resolve(DOCUMENTS));
            IndexManifest manifest = new IndexManifest(
                    IndexManifest.FORMAT_VERSION,
                    descriptor.embeddingModel(),
                    state.index().dimension(),
                    descriptor.taxonomy(),
                    describeFiles(staging),
                    state.documentCount(),
                    state.vectorCount(),
                    clock.instant());
            mapper.writerWithDefaultPrettyPrinter().writeValue(staging.resolve(MANIFEST).toFile(), manifest);
            Path snapshot = activate(staging).snapshotDirectory();
            activated = true;
            log.info("index.save.completed snapshot={} documents={} vectors={}",
                    snapshot.getFileName(), manifest.documentCount(), manifest.vectorCount());
            return snapshot;
        } finally {
            if (!activated) {
                discard(staging);
            }
        }
    }

    /**
     * Verifies a fully written directory, moves it under the root as a new
     * snapshot and swaps the {@code CURRENT} pointer to it.
     *
     * @throws CorruptIndexException when the directory does not match its manifest
     */
    public LoadedIndex activate(Path stagedDirectory) throws IOException {
        LoadedIndex verified = readSnapshot(stagedDirectory);
        Files.createDirectories(root);
        Path snapshot = root.resolve(newSnapshotName(nextSequence()));
        Files.move(stagedDirectory, snapshot, StandardCopyOption.ATOMIC_MOVE);

        Path pointerTmp = root.resolve(CURRENT + ".tmp");
        try {
            Files.writeString(pointerTmp, snapshot.getFileName().toString(), StandardCharsets.UTF_8);
            Files.move(pointerTmp, root.resolve(CURRENT), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            discard(snapshot);
            Files.deleteIfExists(pointerTmp);
            throw e;
        }

        pruneSnapshots(snapshot);
        return new LoadedIndex(verified.state(), verified.manifest(), snapshot);
    }

    /**
     * @return empty when nothing has been persisted under the root yet
     * @throws CorruptIndexException when the active snapshot fails verification
     */
    public Optional<LoadedIndex> load() throws IOException {
        Optional<Path> active = activeSnapshot();
        if (active.isEmpty()) {
            return Optional.empty();
        }
        LoadedIndex loaded = readSnapshot(active.get());
        log.info("index.load.completed snapshot={} documents={} vectors={}",
                active.get().getFileName(), loaded.manifest().documentCount(), loaded.manifest().vectorCount());
        return Optional.of(loaded);
    }

    public Optional<Path> activeSnapshot() throws IOException {
        Path pointer = root.resolve(CURRENT);
        if (!Files.exists(pointer)) {
            return Optional.empty();
        }
        String name = Files.readString(pointer, StandardCharsets.UTF_8).strip();
        if (!name.startsWith(SNAPSHOT_PREFIX) || name.contains("/") || name.contains("\\")) {
            throw new CorruptIndexException("CURRENT names an invalid snapshot: '" + name + "'");
        }
        Path snapshot = root.resolve(name);
        if (!Files.isDirectory(snapshot)) {
            throw new CorruptIndexException("Active snapshot " + name + " is missing");
        }
        return Optional.of(snapshot);
    }

    public IndexManifest readManifest(Path snapshotDirectory) throws IOException {
        Path manifestFile = snapshotDirectory.resolve(MANIFEST);
        if (!Files.isRegularFile(manifestFile)) {
            throw new CorruptIndexException("Manifest missing in " + snapshotDirectory.getFileName());
        }
        try {
            return mapper.readValue(manifestFile.toFile(), IndexManifest.class);
        } catch (JsonProcessingException e) {
            throw new CorruptIndexException("Manifest in " + snapshotDirectory.getFileName() + " is unreadable", e);
        }
    }

    /**
     * Checks that every file the manifest requires is present with the declared
     * size and digest, without parsing the contents.
     */
    public IndexManifest verifyFiles(Path snapshotDirectory) throws IOException {
        IndexManifest manifest = readManifest(snapshotDirectory);
        if (manifest.formatVersion() != IndexManifest.FORMAT_VERSION) {
            throw new CorruptIndexException("Unsupported snapshot format version " + manifest.formatVersion());
        }
        for (String required : REQUIRED_FILES) {
            if (manifest.file(required).isEmpty()) {
                throw new CorruptIndexException("Manifest does not declare required file " + required);
            }
        }
        for (IndexManifest.ManifestFile declared : manifest.files()) {
            Path file = snapshotDirectory.resolve(declared.name()).normalize();
            if (!file.startsWith(snapshotDirectory.normalize()) || !Files.isRegularFile(file)) {
                throw new CorruptIndexException("Declared file " + declared.name() + " is missing");
            }
            long size = Files.size(file);
            if (size != declared.sizeBytes()) {
                throw new CorruptIndexException("Declared file " + declared.name() + " has " + size
                        + " bytes, manifest says " + declared.sizeBytes());
            }
            if (declared.sha256() != null && !declared.sha256().equals(ContentHasher.sha256(file))) {
                throw new CorruptIndexException("Declared file " + declared.name() + " fails its checksum");
            }
        }
        return manifest;
    }

    /**
     * Reads and fully verifies a snapshot directory. Nothing is returned unless
     * the declared files, counts and ids all agree.
     */
    public LoadedIndex readSnapshot(Path snapshotDirectory) throws IOException {
        IndexManifest manifest = verifyFiles(snapshotDirectory);

        DocumentStore documents = new DocumentStore();
        for (Document document : readDocuments(snapshotDirectory.resolve(DOCUMENTS))) {
            if (!documents.add(document)) {
                throw new CorruptIndexException("Duplicate content hash for document " + document.id());
            }
        }
        LocalJsonVectorIndex index;
        try {
            index = LocalJsonVectorIndex.load(snapshotDirectory.resolve(VECTORS));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptIndexException("Vector file in " + snapshotDirectory.getFileName() + " is unreadable", e);
        }

        if (documents.size() != manifest.documentCount()) {
            throw new CorruptIndexException("Read " + documents.size() + " documents, manifest declares "
                    + manifest.documentCount());
        }
        if (index.size() != manifest.vectorCount()) {
            throw new CorruptIndexException("Read " + index.size() + " vectors, manifest declares "
                    + manifest.vectorCount());
        }
        IndexState state = new IndexState(documents, index);
        String problem = state.inconsistency();
        if (problem != null) {
            throw new CorruptIndexException(problem);
        }
        if (index.size() > 0 && index.dimension() != manifest.embeddingDimension()) {
            throw new CorruptIndexException("Vectors have " + index.dimension() + " dimensions, manifest declares "
                    + manifest.embeddingDimension());
        }
        return new LoadedIndex(state, manifest, snapshotDirectory);
    }

    protected void writeVectors(LocalJsonVectorIndex index, Path target) throws IOException {
        index.save(target);
    }

    protected void writeDocuments(List<Document> documents, Path target) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Document document : documents) {
                writer.write(mapper.writeValueAsString(DocumentRecord.from(document)));
                writer.newLine();
            }
        }
    }

    private List<Document> readDocuments(Path source) throws IOException {
        List<Document> documents = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(source, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            DocumentRecord record;
            try {
                record = mapper.readValue(line, DocumentRecord.class);
            } catch (JsonProcessingException e) {
                throw new CorruptIndexException("documents.jsonl line " + lineNumber + " is unreadable", e);
            }
            if (record.id() == null || record.text() == null || record.category() == null || record.contentHash() == null) {
                throw new CorruptIndexException("documents.jsonl line " + lineNumber + " is incomplete");
            }
            if (record.contentHash().length() < ContentHasher.ID_LENGTH
                    || !record.id().equals(ContentHasher.documentId(record.contentHash()))) {
                throw new CorruptIndexException("documents.jsonl line " + lineNumber + ": id " + record.id()
                        + " does not match its content hash");
            }
            if (!seenIds.add(record.id())) {
                throw new CorruptIndexException("documents.jsonl line " + lineNumber + " repeats id " + record.id());
            }
            documents.add(record.toDocument());
        }
        return documents;
    }

    private List<IndexManifest.ManifestFile> describeFiles(Path directory) throws IOException {
        List<IndexManifest.ManifestFile> files = new ArrayList<>();
        for (String name : REQUIRED_FILES) {
            Path file = directory.resolve(name);
            files.add(new IndexManifest.ManifestFile(name, Files.size(file), ContentHasher.sha256(file)));
        }
        return files;
    }

    /**
     * Returns a new empty directory under the root for a snapshot being written
     * or imported. Callers own its deletion.
     */
    public Path newStagingDirectory() throws IOException {
        Files.createDirectories(root);
        return Files.createDirectory(root.resolve(STAGING_PREFIX + UUID.randomUUID()));
    }

    /**
     * Snapshot names start with a sequence number one past the highest under the
     * root, so saves within the same millisecond still order correctly.
     */
    private String newSnapshotName(long sequence) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return SNAPSHOT_PREFIX + String.format("%010d-%016d", sequence, clock.millis()) + "-" + suffix;
    }

    private long nextSequence() throws IOException {
        long highest = 0;
        for (Path snapshot : snapshotDirectories()) {
            highest = Math.max(highest, sequenceOf(snapshot));
        }
        return highest + 1;
    }

    static long sequenceOf(Path snapshot) {
        String name = snapshot.getFileName().toString();
        int end = name.indexOf('-', SNAPSHOT_PREFIX.length());
        if (!name.startsWith(SNAPSHOT_PREFIX) || end < 0) {
            return -1;
        }
        try {
            return Long.parseLong(name.substring(SNAPSHOT_PREFIX.length(), end));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private List<Path> snapshotDirectories() throws IOException {
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(path -> path.getFileName().toString().startsWith(SNAPSHOT_PREFIX))
                    .toList();
        }
    }

    private void pruneSnapshots(Path active) throws IOException {
        List<Path> previous = snapshotDirectories().stream()
                .filter(path -> !path.equals(active))
                .sorted(Comparator.comparingLong((Path path) -> sequenceOf(path)).reversed())
                .toList();
        for (int i = retainedSnapshots; i < previous.size(); i++) {
            discard(previous.get(i));
            log.debug("index.snapshot.pruned snapshot={}", previous.get(i).getFileName());
        }
    }

    /**
     * Deletes a directory that is not, or no longer, active. A failure leaves
     * garbage behind but never affects the active snapshot, so it is logged.
     */
    public static void discard(Path directory) {
        try {
            deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("index.cleanup.failed path={} reason={}", directory, e.toString());
        }
    }

    /**
     * Removes staging directories left behind by a process that died mid-save.
     */
    public void cleanupStaging() throws IOException {
        if (!Files.isDirectory(root)) {
            return;
        }
        Set<Path> stale = new HashSet<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(path -> path.getFileName().toString().startsWith(STAGING_PREFIX)).forEach(stale::add);
        }
        for (Path path : stale) {
            log.warn("index.staging.stale path={}", path.getFileName());
            discard(path);
        }
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(entry -> {
                try {
                    Files.delete(entry);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
