package com.newsrag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.newsrag.retrieval.CategoryRetrievalResult;
import com.newsrag.retrieval.CategorySection;
import com.newsrag.retrieval.SearchResult;

class PromptBuilderTest {

    @Test
    void shouldStopAddingFragmentsAtBudget() {
        PromptBuilder builder = new PromptBuilder(300, 100);
        List<SearchResult> results = List.of(
                AnswerSynthesizerTest.hit("a".repeat(150), "Economy", 0.9f),
                AnswerSynthesizerTest.hit("b".repeat(150), "Economy", 0.8f));

        PromptBuilder.Prompt prompt = builder.focused("q", results);

        assertEquals(1, prompt.fragmentsUsed().size());
        assertTrue(prompt.context().length() <= 300);
    }

    @Test
    void shouldCutOversizedFirstFragmentToBudget() {
        PromptBuilder builder = new PromptBuilder(120, 0);
        List<SearchResult> results = List.of(AnswerSynthesizerTest.hit("c".repeat(500), "Law", 0.9f));

        PromptBuilder.Prompt prompt = builder.focused("q", results);

        assertEquals(1, prompt.fragmentsUsed().size());
        assertEquals(120, prompt.context().length());
    }

    @Test
    void shouldSplitBudgetAcrossCategoriesWithFloor() {
        PromptBuilder builder = new PromptBuilder(1_000, 600);

        assertEquals(600, builder.perCategoryBudget(9));
        assertEquals(1_000, builder.perCategoryBudget(1));
        assertEquals(600, new PromptBuilder(18_000, 600).perCategoryBudget(30));
        assertEquals(2_000, new PromptBuilder(18_000, 600).perCategoryBudget(9));
    }

    @Test
    void shouldTruncatePreview() {
        String longContext = "x".repeat(PromptBuilder.PREVIEW_CHARS + 50);

        String preview = PromptBuilder.preview(longContext);

        assertEquals(PromptBuilder.PREVIEW_CHARS + 3, preview.length());
        assertTrue(preview.endsWith("..."));
    }

    @Test
    void shouldListCategoriesInTaxonomyOrder() {
        PromptBuilder builder = new PromptBuilder(18_000, 600);
        CategoryRetrievalResult retrieval = new CategoryRetrievalResult("q", 2, List.of(
                CategorySection.noData("Premium"),
                new CategorySection("Economy", List.of(AnswerSynthesizerTest.hit("GDP grows", "Economy", 0.5f)))));

        PromptBuilder.Prompt prompt = builder.allCategories("q", retrieval);

        assertTrue(prompt.messages().get(1).content().contains("in this order: Premium, Economy"));
        assertEquals(1, prompt.fragmentsUsed().size());
    }
}
