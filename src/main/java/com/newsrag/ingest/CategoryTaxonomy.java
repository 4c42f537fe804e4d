package com.newsrag.ingest;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Fixed, ordered list of category names. Independent of what the store holds.
 */
public final class CategoryTaxonomy {
    private final List<String> categories;

    public CategoryTaxonomy(List<String> categories) {
        Objects.requireNonNull(categories, "categories");
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("taxonomy must contain at least one category");
        }
        if (new LinkedHashSet<>(categories).size() != categories.size()) {
            throw new IllegalArgumentException("taxonomy must not contain duplicates: " + categories);
        }
        this.categories = List.copyOf(categories);
    }

    public static CategoryTaxonomy of(String... categories) {
        return new CategoryTaxonomy(List.of(categories));
    }

    public List<String> categories() {
        return categories;
    }

    public int size() {
        return categories.size();
    }

    public boolean contains(String category) {
        return categories.contains(category);
    }

    public String require(String category) {
        if (!contains(category)) {
            throw new IllegalArgumentException("Unknown category '" + category + "'; expected one of " + categories);
        }
        return category;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CategoryTaxonomy taxonomy && categories.equals(taxonomy.categories);
    }

    @Override
    public int hashCode() {
        return categories.hashCode();
    }

    @Override
    public String toString() {
        return categories.toString();
    }
}
