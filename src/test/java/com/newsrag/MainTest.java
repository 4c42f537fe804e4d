package com.newsrag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.newsrag.engine.KnowledgeEngine;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Test
    void shouldPrintStatusForFreshIndex() throws IOException {
        int exitCode = run("--config", config(5).toString());

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(printed().contains("loaded=false documents=0 vectors=0 embeddingModel=hashing-64"));
        assertTrue(printed().contains("snapshot=none"));
    }

    @Test
    void shouldIngestArticlesAndSearchThem() throws IOException {
        Path config = config(5);
        Path articles = tempDir.resolve("articles.jsonl");
        Files.writeString(articles, String.join("\n",
                "{\"url\":\"http://news.test/a\",\"title\":\"Rates\",\"text\":\"The central bank raised interest rates again.\",\"category\":\"Economy\",\"scraped_at\":\"2026-01-14T10:00:00Z\"}",
                "{\"url\":\"http://news.test/b\",\"title\":\"Chips\",\"text\":\"A chipmaker opened a new factory.\",\"category\":\"Technology\",\"scraped_at\":\"2026-01-14T11:00:00Z\"}",
                "{\"url\":\"http://news.test/c\",\"title\":\"Rain\",\"text\":\"Heavy rain is expected.\",\"category\":\"Weather\",\"scraped_at\":\"2026-01-14T12:00:00Z\"}",
                "not json at all"), StandardCharsets.UTF_8);

        int ingestExit = run("--config", config.toString(), "--mode", "ingest", "--input", articles.toString());

        assertEquals(Main.EXIT_OK, ingestExit);
        assertTrue(printed().contains("Indexed 2 new chunks (0 duplicates), 2 documents in index"));

        output.reset();
        int searchExit = run("--config", config.toString(), "--mode", "search", "--query", "interest rates", "--top-k", "1");

        assertEquals(Main.EXIT_OK, searchExit);
        assertTrue(printed().contains("category=Economy"));
        assertTrue(printed().contains("url=http://news.test/a"));

        output.reset();
        int sectionsExit = run("--config", config.toString(), "--mode", "searchAll", "--query", "interest rates");

        assertEquals(Main.EXIT_OK, sectionsExit);
        assertTrue(printed().contains("== Premium ==" + System.lineSeparator() + "(no data)"));
        assertTrue(printed().contains("== Technology =="));
    }

    @Test
    void shouldReportUnavailableWhenSearchingEmptyIndex() throws IOException {
        int exitCode = run("--config", config(5).toString(), "--mode", "search", "--query", "anything");

        assertEquals(Main.EXIT_UNAVAILABLE, exitCode);
        assertTrue(printed().contains(Main.UNAVAILABLE));
    }

    @Test
    void shouldRequireQueryForSearchModes() throws IOException {
        int exitCode = run("--config", config(5).toString(), "--mode", "answer");

        assertEquals(Main.EXIT_USAGE, exitCode);
    }

    @Test
    void shouldRejectInvalidConfiguration() throws IOException {
        int exitCode = run("--config", config(0).toString());

        assertEquals(Main.EXIT_CONFIGURATION, exitCode);
        assertTrue(printed().contains("retrieval.topK must be > 0"));
    }

    @Test
    void shouldExportAndRestoreBundle() throws IOException {
        Path config = config(5);
        Path articles = tempDir.resolve("articles.jsonl");
        Files.writeString(articles,
                "{\"url\":\"http://news.test/w\",\"text\":\"Unions agree a new pay deal.\",\"category\":\"Work\"}\n",
                StandardCharsets.UTF_8);
        run("--config", config.toString(), "--mode", "ingest", "--input", articles.toString());
        Path bundle = tempDir.resolve("backup.zip");

        int exportExit = run("--config", config.toString(), "--mode", "export", "--bundle", bundle.toString());
        output.reset();
        int restoreExit = run("--config", config.toString(), "--mode", "restore", "--bundle", bundle.toString());

        assertEquals(Main.EXIT_OK, exportExit);
        assertEquals(Main.EXIT_OK, restoreExit);
        assertTrue(printed().contains("documents=1 vectors=1"));
        assertTrue(printed().contains("backupComplete=true"));
    }

    @Test
    void shouldRestoreOverCorruptActiveSnapshot() throws IOException {
        Path config = config(5);
        Path articles = articles("{\"url\":\"http://news.test/l\",\"text\":\"Court blocks merger.\",\"category\":\"Law\"}");
        run("--config", config.toString(), "--mode", "ingest", "--input", articles.toString());
        Path bundle = tempDir.resolve("backup.zip");
        run("--config", config.toString(), "--mode", "export", "--bundle", bundle.toString());
        Path root = tempDir.resolve("index");
        String active = Files.readString(root.resolve("CURRENT"), StandardCharsets.UTF_8).strip();
        Files.writeString(root.resolve(active).resolve("documents.jsonl"), "garbage\n", StandardCharsets.UTF_8);

        output.reset();
        assertEquals(Main.EXIT_REJECTED, run("--config", config.toString(), "--mode", "status"));

        output.reset();
        int restoreExit = run("--config", config.toString(), "--mode", "restore", "--bundle", bundle.toString());

        assertEquals(Main.EXIT_OK, restoreExit);
        assertTrue(printed().contains("documents=1 vectors=1"));
        assertTrue(printed().contains("backupComplete=true"));
        output.reset();
        assertEquals(Main.EXIT_OK, run("--config", config.toString(), "--mode", "status"));
    }

    @Test
    void shouldRestoreOverSnapshotFromAnotherEmbeddingModel() throws IOException {
        Path articles = articles("{\"url\":\"http://news.test/r\",\"text\":\"House prices ease.\",\"category\":\"RealEstate\"}");
        Path current = config(5, "index", 64);
        Path bundle = tempDir.resolve("backup-64.zip");
        run("--config", config(5, "donor", 64).toString(), "--mode", "ingest", "--input", articles.toString());
        run("--config", config(5, "donor", 64).toString(), "--mode", "export", "--bundle", bundle.toString());
        run("--config", config(5, "index", 32).toString(), "--mode", "ingest", "--input", articles.toString());

        output.reset();
        assertEquals(Main.EXIT_CONFIGURATION, run("--config", current.toString(), "--mode", "status"));

        output.reset();
        int restoreExit = run("--config", current.toString(), "--mode", "restore", "--bundle", bundle.toString());

        assertEquals(Main.EXIT_OK, restoreExit);
        assertTrue(printed().contains("documents=1 vectors=1 embeddingModel=hashing-64"));
    }

    @Test
    void shouldRejectBundleThatIsNotAnArchive() throws IOException {
        Path bogus = tempDir.resolve("bogus.zip");
        Files.writeString(bogus, "plain text", StandardCharsets.UTF_8);

        int exitCode = run("--config", config(5).toString(), "--mode", "restore", "--bundle", bogus.toString());

        assertEquals(Main.EXIT_REJECTED, exitCode);
        assertTrue(printed().contains("Bundle rejected"));
    }

    private Path articles(String... lines) throws IOException {
        Path articles = tempDir.resolve("articles-" + lines.length + "-" + Math.abs(lines[0].hashCode()) + ".jsonl");
        Files.writeString(articles, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return articles;
    }

    private int run(String... args) {
        Main main = new Main(KnowledgeEngine::create, new PrintStream(output, true, StandardCharsets.UTF_8));
        return new CommandLine(main).execute(args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private Path config(int topK) throws IOException {
        return config(topK, "index", 64);
    }

    private Path config(int topK, String root, int dimension) throws IOException {
        Path config = tempDir.resolve("application-" + topK + "-" + root + "-" + dimension + ".yml");
        Files.writeString(config, String.join("\n",
                "embedding:",
                "  strategy: HASHING",
                "  dimension: " + dimension,
                "synthesis:",
                "  apiKey: test-key",
                "retrieval:",
                "  topK: " + topK,
                "persistence:",
                "  root: '" + tempDir.resolve(root).toString().replace("'", "''") + "'",
                ""), StandardCharsets.UTF_8);
        return config;
    }
}
