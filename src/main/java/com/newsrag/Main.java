package com.newsrag;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.backup.BackupBundle;
import com.newsrag.engine.BuildMode;
import com.newsrag.engine.ConfigurationException;
import com.newsrag.engine.EmptyIndexException;
import com.newsrag.engine.ImportRejectedException;
import com.newsrag.engine.IndexStatus;
import com.newsrag.engine.KnowledgeEngine;
import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.engine.SynthesisException;
import com.newsrag.inference.Answer;
import com.newsrag.ingest.Article;
import com.newsrag.ingest.ArticleChunker;
import com.newsrag.ingest.ArticleJsonlReader;
import com.newsrag.ingest.DocumentSubmission;
import com.newsrag.ingest.IngestionReport;
import com.newsrag.persistence.CorruptIndexException;
import com.newsrag.retrieval.CategoryRetrievalResult;
import com.newsrag.retrieval.CategorySection;
import com.newsrag.retrieval.SearchResult;
import com.newsrag.runtime.EngineConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "news-rag",
        mixinStandardHelpOptions = true,
        version = "news-rag 0.1.0",
        description = "Category-balanced retrieval and answer synthesis over a news index.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNAVAILABLE = 3;
    static final int EXIT_REJECTED = 4;

    static final String UNAVAILABLE = "The knowledge base is currently unavailable";

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--query", description = "Query text for search and answer modes")
    String query;

    @Option(names = "--top-k", description = "Results for search/answer (defaults to retrieval.topK)")
    Integer topK;

    @Option(names = "--per-category-k", description = "Results per category for searchAll/answerAll (defaults to retrieval.perCategoryK)")
    Integer perCategoryK;

    @Option(names = "--input", description = "articles.jsonl to ingest")
    Path input;

    @Option(names = "--full", description = "Replace the whole corpus instead of adding to it", defaultValue = "false")
    boolean fullRebuild;

    @Option(names = "--bundle", description = "Backup bundle path for export and restore")
    Path bundle;

    private final Function<EngineConfig, KnowledgeEngine> engineFactory;
    private final PrintStream out;

    enum Mode {
        ingest,
        search,
        searchAll,
        answer,
        answerAll,
        export,
        restore,
        status
    }

    public Main() {
        this(KnowledgeEngine::create, System.out);
    }

    Main(Function<EngineConfig, KnowledgeEngine> engineFactory, PrintStream out) {
        this.engineFactory = engineFactory;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        log.info("Starting news-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);

        KnowledgeEngine engine;
        try {
            EngineConfig config = EngineConfig.load(configPath).validate();
            engine = engineFactory.apply(config);
            if (mode != Mode.restore) {
                // restore must work while the active snapshot cannot be loaded
                engine.load();
            }
        } catch (ConfigurationException e) {
            log.error("Configuration rejected: {}", e.getMessage());
            out.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (CorruptIndexException e) {
            log.error("Persisted index failed verification: {}", e.getMessage());
            out.println("Persisted index is corrupt: " + e.getMessage());
            return EXIT_REJECTED;
        }

        try {
            return run(engine);
        } catch (EmptyIndexException | ProviderUnavailableException e) {
            log.warn("Query failed: {}", e.getMessage());
            out.println(UNAVAILABLE + ": " + e.getMessage());
            return EXIT_UNAVAILABLE;
        } catch (SynthesisException e) {
            log.warn("Synthesis failed: {}", e.getMessage());
            out.println(UNAVAILABLE + ": " + e.getMessage());
            if (!e.fragments().isEmpty()) {
                out.println("Retrieved fragments:");
                printResults(e.fragments());
            }
            return EXIT_UNAVAILABLE;
        } catch (ImportRejectedException | CorruptIndexException e) {
            log.error("Bundle rejected: {}", e.getMessage());
            out.println("Bundle rejected: " + e.getMessage());
            return EXIT_REJECTED;
        }
    }

    private int run(KnowledgeEngine engine) throws IOException {
        switch (mode) {
            case ingest:
                return ingest(engine);
            case search:
                if (!requireQuery()) {
                    return EXIT_USAGE;
                }
                printResults(topK == null ? engine.search(query) : engine.search(query, topK));
                return EXIT_OK;
            case searchAll:
                if (!requireQuery()) {
                    return EXIT_USAGE;
                }
                printSections(perCategoryK == null ? engine.searchAllCategories(query)
                        : engine.searchAllCategories(query, perCategoryK));
                return EXIT_OK;
            case answer:
                if (!requireQuery()) {
                    return EXIT_USAGE;
                }
                printAnswer(topK == null ? engine.answer(query) : engine.answer(query, topK));
                return EXIT_OK;
            case answerAll:
                if (!requireQuery()) {
                    return EXIT_USAGE;
                }
                printAnswer(perCategoryK == null ? engine.answerAllCategories(query)
                        : engine.answerAllCategories(query, perCategoryK));
                return EXIT_OK;
            case export:
                if (bundle == null) {
                    log.error("--bundle is required in export mode");
                    return EXIT_USAGE;
                }
                BackupBundle exported = engine.exportBundle(bundle);
                out.println("Exported " + exported.manifest().documentCount() + " documents to " + exported.path()
                        + " (" + exported.sizeBytes() + " bytes)");
                return EXIT_OK;
            case restore:
                if (bundle == null) {
                    log.error("--bundle is required in restore mode");
                    return EXIT_USAGE;
                }
                printStatus(engine.importBundle(bundle));
                return EXIT_OK;
            case status:
            default:
                printStatus(engine.status());
                return EXIT_OK;
        }
    }

    private int ingest(KnowledgeEngine engine) throws IOException {
        if (input == null) {
            log.error("--input is required in ingest mode");
            return EXIT_USAGE;
        }
        List<Article> articles = new ArticleJsonlReader().read(input);
        ArticleChunker chunker = new ArticleChunker();
        List<DocumentSubmission> submissions = new ArrayList<>();
        int unknownCategory = 0;
        for (Article article : articles) {
            if (article.category() == null || !engine.taxonomy().contains(article.category())) {
                log.warn("Skipping article url={} category={}: not in taxonomy", article.url(), article.category());
                unknownCategory++;
                continue;
            }
            submissions.addAll(chunker.toSubmissions(article));
        }
        IngestionReport report = engine.buildIndex(submissions, fullRebuild ? BuildMode.FULL : BuildMode.INCREMENTAL);
        Path snapshot = engine.save();
        log.info("Indexed articles={} skipped={} chunks={} added={} duplicates={} total={} snapshot={}",
                articles.size(), unknownCategory, report.submitted(), report.added(), report.duplicates(),
                report.totalDocuments(), snapshot.getFileName());
        out.println("Indexed " + report.added() + " new chunks (" + report.duplicates() + " duplicates), "
                + report.totalDocuments() + " documents in index");
        return EXIT_OK;
    }

    private boolean requireQuery() {
        if (query == null || query.isBlank()) {
            log.error("--query is required in {} mode", mode);
            return false;
        }
        return true;
    }

    private void printResults(List<SearchResult> results) {
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            out.println("#" + (i + 1) + " score=" + String.format(Locale.ROOT, "%.4f", result.score())
                    + " category=" + result.document().category()
                    + " id=" + result.document().id()
                    + (result.document().sourceUrl() == null ? "" : " url=" + result.document().sourceUrl()));
            out.println("   " + firstLine(result.document().text()));
        }
    }

    private void printSections(CategoryRetrievalResult retrieval) {
        for (CategorySection section : retrieval.sections()) {
            out.println("== " + section.category() + " ==");
            if (section.noData()) {
                out.println("(no data)");
                continue;
            }
            printResults(section.results());
        }
    }

    private void printAnswer(Answer answer) {
        out.println(answer.text());
        out.println();
        out.println("characters=" + answer.characterCount() + " fragments=" + answer.fragments().size()
                + " model=" + answer.model());
        if (!answer.categoriesEmpty().isEmpty()) {
            out.println("categories without data: " + String.join(", ", answer.categoriesEmpty()));
        }
    }

    private void printStatus(IndexStatus status) {
        out.println("loaded=" + status.loaded()
                + " documents=" + status.documentCount()
                + " vectors=" + status.vectorCount()
                + " embeddingModel=" + status.embeddingModel());
        out.println("snapshot=" + (status.activeSnapshot() == null ? "none" : status.activeSnapshot())
                + " backupComplete=" + status.backupComplete()
                + " unsavedChanges=" + status.unsavedChanges());
        out.println("cache hits=" + status.cacheStats().hits()
                + " misses=" + status.cacheStats().misses()
                + " size=" + status.cacheStats().size() + "/" + status.cacheStats().capacity());
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        String line = newline < 0 ? text : text.substring(0, newline);
        return line.length() > 160 ? line.substring(0, 160) + "..." : line;
    }
}
