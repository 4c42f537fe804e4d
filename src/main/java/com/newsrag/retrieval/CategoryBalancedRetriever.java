package com.newsrag.retrieval;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.newsrag.ingest.CategoryTaxonomy;
import com.newsrag.ingest.Document;
import com.newsrag.ingest.IndexState;

/**
 * Ranks each taxonomy category on its own so minority categories are never
 * crowded out by a global top-k. Categories without documents come back as
 * explicit no-data sections.
 */
public class CategoryBalancedRetriever {
    private static final Logger log = LoggerFactory.getLogger(CategoryBalancedRetriever.class);

    private final CategoryTaxonomy taxonomy;
    private final RetrievalService retrievalService;

    public CategoryBalancedRetriever(CategoryTaxonomy taxonomy, RetrievalService retrievalService) {
        this.taxonomy = taxonomy;
        this.retrievalService = retrievalService;
    }

    public CategoryRetrievalResult retrieve(IndexState state, String query, int perCategoryK) {
        if (perCategoryK <= 0) {
            throw new IllegalArgumentException("perCategoryK must be > 0");
        }
        List<List<Document>> candidatesPerCategory = new ArrayList<>();
        boolean anyCandidates = false;
        for (String category : taxonomy.categories()) {
            List<Document> candidates = state.documents().byCategory(category);
            candidatesPerCategory.add(candidates);
            anyCandidates |= !candidates.isEmpty();
        }

        // The query is embedded once, and only when some category can use it.
        float[] queryEmbedding = anyCandidates ? retrievalService.embedQuery(query) : null;

        List<CategorySection> sections = new ArrayList<>();
        for (int i = 0; i < taxonomy.size(); i++) {
            String category = taxonomy.categories().get(i);
            List<Document> candidates = candidatesPerCategory.get(i);
            if (candidates.isEmpty()) {
                log.debug("retrieval.category.empty category={}", category);
                sections.add(CategorySection.noData(category));
                continue;
            }
            Set<String> allowed = new HashSet<>();
            candidates.forEach(document -> allowed.add(document.id()));
            sections.add(new CategorySection(category,
                    retrievalService.rank(state, queryEmbedding, perCategoryK, allowed::contains)));
        }
        return new CategoryRetrievalResult(query, perCategoryK, sections);
    }

    public CategoryTaxonomy taxonomy() {
        return taxonomy;
    }
}
