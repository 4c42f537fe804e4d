package com.newsrag.inference;

import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.engine.ProviderUnavailableException;
import com.newsrag.engine.SynthesisException;
import com.newsrag.retrieval.CategoryRetrievalResult;
import com.newsrag.retrieval.CategorySection;
import com.newsrag.retrieval.SearchResult;

/**
 * One model call per answer. Any failure, including an empty reply, becomes a
 * {@link SynthesisException} that carries the retrieval so callers can still
 * show the fragments.
 */
public class AnswerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final String NO_NEW_INFORMATION = "No new information in this category.";

    private final ChatModel chatModel;
    private final PromptBuilder promptBuilder;

    public AnswerSynthesizer(ChatModel chatModel, PromptBuilder promptBuilder) {
        this.chatModel = chatModel;
        this.promptBuilder = promptBuilder;
    }

    public Answer answer(String query, List<SearchResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("Focused answers need at least one retrieved fragment");
        }
        PromptBuilder.Prompt prompt = promptBuilder.focused(query, results);
        String text;
        try {
            text = complete(prompt);
        } catch (ProviderUnavailableException e) {
            log.warn("synthesis.failed mode=focused model={} reason={}", chatModel.modelId(), e.getMessage());
            throw new SynthesisException("Answer synthesis failed: " + e.getMessage(), results, e);
        }
        if (text == null) {
            throw new SynthesisException("Model " + chatModel.modelId() + " returned an empty answer", results, null);
        }
        log.info("synthesis.completed mode=focused model={} fragments={} chars={}",
                chatModel.modelId(), prompt.fragmentsUsed().size(), text.length());
        return new Answer(query, AnswerMode.FOCUSED, text, text.length(), prompt.fragmentsUsed(),
                PromptBuilder.preview(prompt.context()), List.of(), List.of(), chatModel.modelId(), true);
    }

    public Answer answerAllCategories(String query, CategoryRetrievalResult retrieval) {
        List<String> withData = retrieval.categoriesWithData();
        List<String> empty = retrieval.categoriesWithoutData();
        if (withData.isEmpty()) {
            String text = noDataBriefing(retrieval);
            log.info("synthesis.skipped mode=all_categories reason=no_data categories={}", empty.size());
            return new Answer(query, AnswerMode.ALL_CATEGORIES, text, text.length(), List.of(),
                    "", withData, empty, chatModel.modelId(), false);
        }

        PromptBuilder.Prompt prompt = promptBuilder.allCategories(query, retrieval);
        String text;
        try {
            text = complete(prompt);
        } catch (ProviderUnavailableException e) {
            log.warn("synthesis.failed mode=all_categories model={} reason={}", chatModel.modelId(), e.getMessage());
            throw new SynthesisException("Answer synthesis failed: " + e.getMessage(), retrieval, e);
        }
        if (text == null) {
            throw new SynthesisException("Model " + chatModel.modelId() + " returned an empty answer", retrieval, null);
        }
        warnOnMissingSections(text, retrieval);
        log.info("synthesis.completed mode=all_categories model={} withData={} empty={} chars={}",
                chatModel.modelId(), withData.size(), empty.size(), text.length());
        return new Answer(query, AnswerMode.ALL_CATEGORIES, text, text.length(), prompt.fragmentsUsed(),
                PromptBuilder.preview(prompt.context()), withData, empty, chatModel.modelId(), true);
    }

    private String complete(PromptBuilder.Prompt prompt) {
        String reply = chatModel.complete(prompt.messages());
        if (reply == null || reply.isBlank()) {
            return null;
        }
        return reply.strip();
    }

    static String noDataBriefing(CategoryRetrievalResult retrieval) {
        StringBuilder text = new StringBuilder();
        for (CategorySection section : retrieval.sections()) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append(section.category()).append('\n').append(NO_NEW_INFORMATION);
        }
        return text.toString();
    }

    private static void warnOnMissingSections(String text, CategoryRetrievalResult retrieval) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (CategorySection section : retrieval.sections()) {
            if (!lower.contains(section.category().toLowerCase(Locale.ROOT))) {
                log.warn("synthesis.section.missing category={}", section.category());
            }
        }
    }
}
