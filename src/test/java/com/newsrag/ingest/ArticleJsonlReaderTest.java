package com.newsrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArticleJsonlReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipInvalidLinesAndKeepLatestVersionPerUrl() throws Exception {
        Path file = tempDir.resolve("articles.jsonl");
        Files.writeString(file, """
                {"url":"http://x/1","title":"Old","text":"first draft","category":"Business","scraped_at":"2026-01-01T10:00:00"}
                not json at all

                {"url":"http://x/2","title":"No body","category":"Law"}
                {"url":"http://x/1","title":"New","text":"final text","category":"Business","scraped_at":"2026-01-02T10:00:00"}
                {"url":"http://x/3","title":"Chips","text":"exports rise","category":"Technology","scraped_at":"2026-01-01T09:00:00","extra":1}
                {"url":"http://x/1","title":"Stale","text":"older copy","category":"Business","scraped_at":"2025-12-31T10:00:00"}
                """);

        List<Article> articles = new ArticleJsonlReader().read(file);

        assertEquals(2, articles.size());
        assertEquals("New", articles.get(0).title());
        assertEquals("final text", articles.get(0).text());
        assertEquals("Technology", articles.get(1).category());
    }
}
