package com.newsrag.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.newsrag.ingest.Document;
import com.newsrag.retrieval.CategoryRetrievalResult;
import com.newsrag.retrieval.CategorySection;
import com.newsrag.retrieval.SearchResult;

/**
 * Turns retrieval output into chat messages while keeping the context block
 * inside a character budget.
 */
public class PromptBuilder {
    static final int PREVIEW_CHARS = 2000;
    static final String NO_DATA = "(no data)";

    private static final String FOCUSED_SYSTEM = "You are a news analyst. Answer clearly and briefly, "
            + "using only the fragments provided. If the fragments are incomplete, say what is missing.";

    private static final String ALL_CATEGORIES_SYSTEM = "You are a business journalist preparing a morning briefing. "
            + "Write concise, factual prose with numbers, dates, company and people names where available. "
            + "Each category gets its own paragraph of 2-4 sentences. Never blend facts from one category into another. "
            + "Cover every listed category, even when it has no data. Use only the context provided.";

    private final int contextMaxChars;
    private final int minCategoryContextChars;

    public PromptBuilder(int contextMaxChars, int minCategoryContextChars) {
        if (contextMaxChars <= 0) {
            throw new IllegalArgumentException("contextMaxChars must be > 0");
        }
        this.contextMaxChars = contextMaxChars;
        this.minCategoryContextChars = Math.max(0, minCategoryContextChars);
    }

    public Prompt focused(String query, List<SearchResult> results) {
        Context context = buildContext(results, contextMaxChars);
        String user = "Question:\n" + query + "\n\n"
                + "Fragments:\n" + context.text() + "\n\n"
                + "Write a plain-language answer in 4-8 sentences. "
                + "Where it helps, add up to 3 short bullet points with the key facts.";
        return new Prompt(List.of(ChatMessage.system(FOCUSED_SYSTEM), ChatMessage.user(user)),
                context.text(), context.used());
    }

    public Prompt allCategories(String query, CategoryRetrievalResult retrieval) {
        List<CategorySection> sections = retrieval.sections();
        int perCategory = perCategoryBudget(sections.size());

        List<String> blocks = new ArrayList<>();
        List<SearchResult> used = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (CategorySection section : sections) {
            names.add(section.category());
            String heading = "### " + section.category().toUpperCase(Locale.ROOT) + " ###\n";
            if (section.noData()) {
                blocks.add(heading + NO_DATA);
                continue;
            }
            Context context = buildContext(section.results(), perCategory);
            used.addAll(context.used());
            blocks.add(heading + context.text());
        }
        String contextText = String.join("\n\n", blocks);

        String user = "Prepare a news briefing covering ALL of the following "
                + sections.size() + " categories, in this order: " + String.join(", ", names) + "\n\n"
                + "Sources per category:\n" + contextText + "\n\n"
                + "Instructions:\n"
                + "1. Write one section per category, headed by the category name.\n"
                + "2. Each section is 2-4 sentences of flowing prose, no bullet points.\n"
                + "3. A section marked " + NO_DATA + " must say: No new information in this category.\n"
                + "4. Use facts from a category's own sources only.";
        return new Prompt(List.of(ChatMessage.system(ALL_CATEGORIES_SYSTEM), ChatMessage.user(user)),
                contextText, used);
    }

    int perCategoryBudget(int categoryCount) {
        int share = contextMaxChars / Math.max(1, categoryCount);
        return Math.min(contextMaxChars, Math.max(share, minCategoryContextChars));
    }

    /**
     * Fragments are added in rank order until the next one would overflow the
     * budget. The first fragment is always present, cut to fit if necessary.
     */
    Context buildContext(List<SearchResult> results, int maxChars) {
        List<String> blocks = new ArrayList<>();
        List<SearchResult> used = new ArrayList<>();
        int total = 0;
        for (SearchResult result : results) {
            String block = fragmentBlock(used.size() + 1, result.document());
            int separator = blocks.isEmpty() ? 0 : 2;
            if (total + separator + block.length() > maxChars) {
                if (blocks.isEmpty()) {
                    blocks.add(block.substring(0, maxChars));
                    used.add(result);
                }
                break;
            }
            blocks.add(block);
            used.add(result);
            total += separator + block.length();
        }
        return new Context(String.join("\n\n", blocks), used);
    }

    private static String fragmentBlock(int position, Document document) {
        String source = document.sourceUrl() == null ? "" : "Source: " + document.sourceUrl() + "\n";
        return "Fragment " + position + " (category=" + document.category() + ", id=" + document.id() + ")\n"
                + source
                + document.text().strip();
    }

    static String preview(String context) {
        if (context.length() <= PREVIEW_CHARS) {
            return context;
        }
        return context.substring(0, PREVIEW_CHARS) + "...";
    }

    public record Prompt(List<ChatMessage> messages, String context, List<SearchResult> fragmentsUsed) {
    }

    record Context(String text, List<SearchResult> used) {
    }
}
