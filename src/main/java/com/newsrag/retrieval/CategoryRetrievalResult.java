package com.newsrag.retrieval;

import java.util.List;
import java.util.Optional;

/**
 * One section per taxonomy category, in taxonomy order.
 */
public record CategoryRetrievalResult(String query, int perCategoryK, List<CategorySection> sections) {
    public CategoryRetrievalResult {
        sections = List.copyOf(sections);
    }

    public Optional<CategorySection> section(String category) {
        return sections.stream().filter(section -> section.category().equals(category)).findFirst();
    }

    public List<SearchResult> allResults() {
        return sections.stream().flatMap(section -> section.results().stream()).toList();
    }

    public List<String> categoriesWithData() {
        return sections.stream().filter(section -> !section.noData()).map(CategorySection::category).toList();
    }

    public List<String> categoriesWithoutData() {
        return sections.stream().filter(CategorySection::noData).map(CategorySection::category).toList();
    }
}
