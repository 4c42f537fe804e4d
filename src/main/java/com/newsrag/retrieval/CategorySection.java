package com.newsrag.retrieval;

import java.util.List;

/**
 * Results for one taxonomy category. A section with no results is the explicit
 * no-data marker for that category.
 */
public record CategorySection(String category, List<SearchResult> results) {
    public CategorySection {
        results = List.copyOf(results);
        for (SearchResult result : results) {
            if (!result.document().category().equals(category)) {
                throw new IllegalArgumentException("section " + category + " cannot hold a "
                        + result.document().category() + " document");
            }
        }
    }

    public static CategorySection noData(String category) {
        return new CategorySection(category, List.of());
    }

    public boolean noData() {
        return results.isEmpty();
    }
}
