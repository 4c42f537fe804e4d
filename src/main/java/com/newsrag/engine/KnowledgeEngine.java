package com.newsrag.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.backup.BackupBundle;
import com.newsrag.backup.BackupManager;
import com.newsrag.inference.Answer;
import com.newsrag.inference.AnswerSynthesizer;
import com.newsrag.inference.ChatModel;
import com.newsrag.inference.ChatModels;
import com.newsrag.inference.PromptBuilder;
import com.newsrag.ingest.CacheStats;
import com.newsrag.ingest.CachingEmbeddingService;
import com.newsrag.ingest.CategoryTaxonomy;
import com.newsrag.ingest.ContentHasher;
import com.newsrag.ingest.Document;
import com.newsrag.ingest.DocumentSubmission;
import com.newsrag.ingest.EmbeddingService;
import com.newsrag.ingest.EmbeddingServices;
import com.newsrag.ingest.IndexState;
import com.newsrag.ingest.IngestionReport;
import com.newsrag.persistence.CorruptIndexException;
import com.newsrag.persistence.LoadedIndex;
import com.newsrag.persistence.PersistenceManager;
import com.newsrag.persistence.SnapshotDescriptor;
import com.newsrag.resilience.Sleeper;
import com.newsrag.retrieval.CategoryBalancedRetriever;
import com.newsrag.retrieval.CategoryRetrievalResult;
import com.newsrag.retrieval.RetrievalService;
import com.newsrag.retrieval.SearchResult;
import com.newsrag.runtime.EngineConfig;

import okhttp3.OkHttpClient;

/**
 * The knowledge engine. One instance owns one corpus, its vector index and its
 * persistence root.
 *
 * <p>Readers work on an immutable published {@link IndexState}: every mutation
 * builds a new state off to the side, with embeddings computed beforehand, and
 * publishes it with a single reference swap. Mutations are serialised by one
 * writer lock, so documents and vectors are never observed out of step.</p>
 *
 * <p>No operation is cancellable once started. Provider and model calls are
 * bounded by their timeouts and retry budget instead.</p>
 */
public class KnowledgeEngine {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeEngine.class);

    private final EngineConfig config;
    private final CategoryTaxonomy taxonomy;
    private final CachingEmbeddingService embeddings;
    private final RetrievalService retrievalService;
    private final CategoryBalancedRetriever categoryRetriever;
    private final AnswerSynthesizer synthesizer;
    private final PersistenceManager persistenceManager;
    private final BackupManager backupManager;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile IndexState state = IndexState.empty();
    private volatile boolean loaded;
    private volatile boolean unsavedChanges;

    public KnowledgeEngine(EngineConfig config, EmbeddingService embeddingProvider, ChatModel chatModel, Clock clock) {
        this.config = config.validate();
        if (embeddingProvider == null) {
            throw new ConfigurationException("An embedding provider is required");
        }
        if (chatModel == null) {
            throw new ConfigurationException("A chat model is required");
        }
        this.clock = clock;
        this.taxonomy = new CategoryTaxonomy(config.getRetrieval().getTaxonomy());
        this.embeddings = new CachingEmbeddingService(
                embeddingProvider,
                Duration.ofMillis(config.getCache().getTtlMs()),
                config.getCache().getCapacity(),
                clock);
        this.retrievalService = new RetrievalService(embeddings);
        this.categoryRetriever = new CategoryBalancedRetriever(taxonomy, retrievalService);
        EngineConfig.SynthesisConfig synthesis = config.getSynthesis();
        this.synthesizer = new AnswerSynthesizer(chatModel,
                new PromptBuilder(synthesis.getContextMaxChars(), synthesis.getMinCategoryContextChars()));
        this.persistenceManager = new PersistenceManager(
                Path.of(config.getPersistence().getRoot()),
                config.getPersistence().getRetainedSnapshots(),
                clock);
        this.backupManager = new BackupManager(persistenceManager, config.getBackup().getMaxBundleBytes());
    }

    /**
     * Wires the configured HTTP providers. Missing credentials fail here.
     */
    public static KnowledgeEngine create(EngineConfig config) {
        config.validate();
        OkHttpClient httpClient = new OkHttpClient();
        Clock clock = Clock.systemUTC();
        EmbeddingService embeddingProvider = EmbeddingServices.fromConfig(config, httpClient, clock, Sleeper.SYSTEM);
        ChatModel chatModel = ChatModels.fromConfig(config, httpClient, clock, Sleeper.SYSTEM);
        log.info("engine.created embeddingStrategy={} embeddingModel={} chatModel={} root={}",
                config.getEmbedding().getStrategy(), embeddingProvider.modelId(), chatModel.modelId(),
                config.getPersistence().getRoot());
        return new KnowledgeEngine(config, embeddingProvider, chatModel, clock);
    }

    /**
     * Adds one document. Identical text already in the store is a no-op that
     * returns the existing id.
     */
    public String ingest(DocumentSubmission submission) {
        taxonomy.require(submission.category());
        String contentHash = ContentHasher.contentHash(submission.text());
        Optional<String> existing = state.documents().idForContentHash(contentHash);
        if (existing.isPresent()) {
            log.debug("engine.ingest.duplicate id={}", existing.get());
            return existing.get();
        }
        Document document = newDocument(submission, contentHash, clock.instant());
        float[] embedding = embeddings.embed(document.embeddingInput());

        writeLock.lock();
        try {
            IndexState current = state;
            Optional<String> raced = current.documents().idForContentHash(contentHash);
            if (raced.isPresent()) {
                return raced.get();
            }
            IndexState next = current.copy();
            next.documents().add(document);
            next.index().add(document.id(), embedding);
            publish(next);
            log.info("engine.ingest.added id={} category={} total={}", document.id(), document.category(),
                    next.documentCount());
            return document.id();
        } finally {
            writeLock.unlock();
        }
    }

    public IngestionReport ingestAll(List<DocumentSubmission> submissions) {
        return buildIndex(submissions, BuildMode.INCREMENTAL);
    }

    /**
     * Bulk ingest. Every vector is computed before anything is published, so a
     * provider failure part way through leaves the index exactly as it was.
     */
    public IngestionReport buildIndex(List<DocumentSubmission> submissions, BuildMode mode) {
        submissions.forEach(submission -> taxonomy.require(submission.category()));
        IndexState base = mode == BuildMode.FULL ? IndexState.empty() : state;
        Instant ingestedAt = clock.instant();

        Map<String, Document> pending = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>();
        int duplicates = 0;
        for (DocumentSubmission submission : submissions) {
            String contentHash = ContentHasher.contentHash(submission.text());
            Optional<String> existing = base.documents().idForContentHash(contentHash);
            if (existing.isPresent() || pending.containsKey(contentHash)) {
                duplicates++;
                ids.add(existing.orElseGet(() -> pending.get(contentHash).id()));
                continue;
            }
            Document document = previousVersion(contentHash, submission)
                    .orElseGet(() -> newDocument(submission, contentHash, ingestedAt));
            pending.put(contentHash, document);
            ids.add(document.id());
        }

        Map<String, float[]> vectors = new LinkedHashMap<>();
        for (Document document : pending.values()) {
            vectors.put(document.id(), embeddings.embed(document.embeddingInput()));
        }

        writeLock.lock();
        try {
            IndexState next = mode == BuildMode.FULL ? IndexState.empty() : state.copy();
            int added = 0;
            for (Document document : pending.values()) {
                if (next.documents().add(document)) {
                    next.index().add(document.id(), vectors.get(document.id()));
                    added++;
                } else {
                    duplicates++;
                }
            }
            next.verifyConsistent();
            publish(next);
            log.info("engine.build.completed mode={} submitted={} added={} duplicates={} total={}",
                    mode, submissions.size(), added, duplicates, next.documentCount());
            return new IngestionReport(submissions.size(), added, duplicates, next.documentCount(), ids);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes a document and its vector together.
     *
     * @return false when no document has that id
     */
    public boolean delete(String documentId) {
        writeLock.lock();
        try {
            if (state.documents().get(documentId).isEmpty()) {
                return false;
            }
            IndexState next = state.copy();
            next.documents().remove(documentId);
            next.index().remove(documentId);
            publish(next);
            log.info("engine.delete.completed id={} total={}", documentId, next.documentCount());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public List<SearchResult> search(String query) {
        return search(query, config.getRetrieval().getTopK());
    }

    /**
     * @throws EmptyIndexException when no documents have been ingested
     */
    public List<SearchResult> search(String query, int topK) {
        return retrievalService.search(state, query, topK);
    }

    public CategoryRetrievalResult searchAllCategories(String query) {
        return searchAllCategories(query, config.getRetrieval().getPerCategoryK());
    }

    /**
     * Always one section per taxonomy category, in taxonomy order, even over an
     * empty corpus.
     */
    public CategoryRetrievalResult searchAllCategories(String query, int perCategoryK) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        return categoryRetriever.retrieve(state, query, perCategoryK);
    }

    public Answer answer(String query) {
        return answer(query, config.getRetrieval().getTopK());
    }

    public Answer answer(String query, int topK) {
        return synthesizer.answer(query, search(query, topK));
    }

    public Answer answerAllCategories(String query) {
        return answerAllCategories(query, config.getRetrieval().getPerCategoryK());
    }

    public Answer answerAllCategories(String query, int perCategoryK) {
        return synthesizer.answerAllCategories(query, searchAllCategories(query, perCategoryK));
    }

    /**
     * Persists the current index and makes it the active snapshot.
     */
    public Path save() throws IOException {
        writeLock.lock();
        try {
            Path snapshot = persistenceManager.save(state, descriptor());
            unsavedChanges = false;
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces the in-memory index with the active persisted snapshot.
     *
     * @return false when nothing has been persisted yet
     * @throws CorruptIndexException when the snapshot fails verification; the
     *                               in-memory index is left as it was
     * @throws ConfigurationException when the snapshot was built with another embedding model
     */
    public boolean load() throws IOException {
        writeLock.lock();
        try {
            persistenceManager.cleanupStaging();
            Optional<LoadedIndex> persisted = persistenceManager.load();
            if (persisted.isEmpty()) {
                log.info("engine.load.none root={}", persistenceManager.root());
                return false;
            }
            LoadedIndex loadedIndex = persisted.get();
            String model = loadedIndex.manifest().embeddingModel();
            if (!embeddings.modelId().equals(model)) {
                throw new ConfigurationException("Persisted index was built with embedding model " + model
                        + ", engine is configured for " + embeddings.modelId());
            }
            for (Document document : loadedIndex.state().documents().all()) {
                if (!taxonomy.contains(document.category())) {
                    throw new ConfigurationException("Persisted index holds category " + document.category()
                            + " which is not in the configured taxonomy " + taxonomy);
                }
            }
            publish(loadedIndex.state());
            unsavedChanges = false;
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Writes the active snapshot to a single archive, saving first when the
     * in-memory index has changed since the last save.
     */
    public BackupBundle exportBundle(Path bundle) throws IOException {
        writeLock.lock();
        try {
            if (unsavedChanges || persistenceManager.activeSnapshot().isEmpty()) {
                save();
            }
            return backupManager.export(bundle);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Validates the bundle, makes it the active snapshot and serves it.
     *
     * @throws ImportRejectedException when the bundle fails validation; nothing changes
     */
    public IndexStatus importBundle(Path bundle) throws IOException {
        writeLock.lock();
        try {
            LoadedIndex imported = backupManager.importBundle(bundle, descriptor());
            publish(imported.state());
            unsavedChanges = false;
            return status();
        } finally {
            writeLock.unlock();
        }
    }

    public IndexStatus status() {
        IndexState current = state;
        String activeSnapshot = null;
        boolean backupComplete = false;
        try {
            Optional<Path> snapshot = persistenceManager.activeSnapshot();
            if (snapshot.isPresent()) {
                activeSnapshot = snapshot.get().getFileName().toString();
                persistenceManager.verifyFiles(snapshot.get());
                backupComplete = true;
            }
        } catch (IOException e) {
            log.warn("engine.status.snapshot_unverified reason={}", e.getMessage());
        }
        return new IndexStatus(
                loaded,
                current.documentCount(),
                current.vectorCount(),
                embeddings.modelId(),
                activeSnapshot,
                backupComplete,
                unsavedChanges,
                embeddings.stats());
    }

    public CacheStats cacheStats() {
        return embeddings.stats();
    }

    public CategoryTaxonomy taxonomy() {
        return taxonomy;
    }

    private void publish(IndexState next) {
        String problem = next.inconsistency();
        if (problem != null) {
            throw new IllegalStateException("Refusing to publish an inconsistent index: " + problem);
        }
        state = next;
        loaded = true;
        unsavedChanges = true;
    }

    private SnapshotDescriptor descriptor() {
        return new SnapshotDescriptor(embeddings.modelId(), taxonomy.categories());
    }

    /**
     * A full rebuild keeps the id and ingestion time of documents it already held
     * under the same category.
     */
    private Optional<Document> previousVersion(String contentHash, DocumentSubmission submission) {
        IndexState current = state;
        return current.documents().idForContentHash(contentHash)
                .flatMap(current.documents()::get)
                .filter(document -> document.category().equals(submission.category()));
    }

    private static Document newDocument(DocumentSubmission submission, String contentHash, Instant ingestedAt) {
        return new Document(
                ContentHasher.documentId(contentHash),
                submission.text().strip(),
                submission.category(),
                submission.sourceUrl(),
                contentHash,
                ingestedAt);
    }
}
