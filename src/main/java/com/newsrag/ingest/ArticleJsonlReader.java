package com.newsrag.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@code articles.jsonl}: one article object per line. Lines that are
 * blank, malformed, or lack a url or text are skipped; when a url repeats the
 * record with the latest {@code scraped_at} wins.
 */
public class ArticleJsonlReader {
    private static final Logger log = LoggerFactory.getLogger(ArticleJsonlReader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public List<Article> read(Path path) throws IOException {
        Map<String, Article> byUrl = new LinkedHashMap<>();
        int lineNumber = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Article article;
                try {
                    article = mapper.readValue(line, Article.class);
                } catch (JsonProcessingException e) {
                    log.warn("articles.skip line={} reason={}", lineNumber, e.getOriginalMessage());
                    skipped++;
                    continue;
                }
                if (article == null || isBlank(article.url()) || isBlank(article.text())) {
                    skipped++;
                    continue;
                }
                String url = article.url().strip();
                Article previous = byUrl.get(url);
                if (previous == null || nullToEmpty(article.scrapedAt()).compareTo(nullToEmpty(previous.scrapedAt())) > 0) {
                    byUrl.put(url, article);
                }
            }
        }
        log.info("articles.read path={} articles={} skipped={}", path, byUrl.size(), skipped);
        return new ArrayList<>(byUrl.values());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
