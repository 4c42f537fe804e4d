package com.newsrag.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits article bodies into overlapping windows of at most {@code chunkSize}
 * characters, cutting at a paragraph break, then a sentence end, then a space
 * when one falls in the second half of the window.
 */
public class ArticleChunker {
    private final int chunkSize;
    private final int overlap;

    public ArticleChunker() {
        this(900, 120);
    }

    public ArticleChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0 || overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("chunkSize must be > 0 and 0 <= overlap < chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<String> chunk(String text) {
        String body = text == null ? "" : text.strip();
        List<String> chunks = new ArrayList<>();
        if (body.isEmpty()) {
            return chunks;
        }
        int start = 0;
        while (start < body.length()) {
            int hardEnd = Math.min(body.length(), start + chunkSize);
            int end = hardEnd == body.length() ? hardEnd : breakPoint(body, start, hardEnd);
            String piece = body.substring(start, end).strip();
            if (!piece.isEmpty()) {
                chunks.add(piece);
            }
            if (end >= body.length()) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
        }
        return chunks;
    }

    public List<DocumentSubmission> toSubmissions(Article article) {
        String title = article.title() == null ? "" : article.title().strip();
        List<DocumentSubmission> submissions = new ArrayList<>();
        for (String piece : chunk(article.text())) {
            String text = title.isEmpty() ? piece : title + "\n" + piece;
            submissions.add(new DocumentSubmission(text, article.category(), article.url()));
        }
        return submissions;
    }

    private int breakPoint(String body, int start, int hardEnd) {
        int floor = start + chunkSize / 2;
        int paragraph = body.lastIndexOf("\n\n", hardEnd);
        if (paragraph >= floor) {
            return paragraph;
        }
        for (int i = hardEnd - 1; i >= floor; i--) {
            char c = body.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && i + 1 < body.length() && Character.isWhitespace(body.charAt(i + 1))) {
                return i + 1;
            }
        }
        int space = body.lastIndexOf(' ', hardEnd);
        return space >= floor ? space : hardEnd;
    }
}
