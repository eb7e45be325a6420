package io.catalogsync.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Live snapshot of a course's document categories: how many documents each
 * category holds on the server and the identifier used to list its files.
 * <p>
 * Categories with no documents are never part of an index.
 */
public final class CatalogIndex {

    private static final CatalogIndex EMPTY = new CatalogIndex(Map.of(), Map.of());

    private final Map<String, Integer> counts;
    private final Map<String, String> categoryIds;

    private CatalogIndex(Map<String, Integer> counts, Map<String, String> categoryIds) {
        this.counts = counts;
        this.categoryIds = categoryIds;
    }

    public static CatalogIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Category name to remote document count, in catalog order.
     */
    public Map<String, Integer> counts() {
        return counts;
    }

    public Optional<String> categoryId(String category) {
        return Optional.ofNullable(categoryIds.get(category));
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CatalogIndex other)) {
            return false;
        }
        return counts.equals(other.counts) && categoryIds.equals(other.categoryIds);
    }

    @Override
    public int hashCode() {
        return 31 * counts.hashCode() + categoryIds.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }

    public static final class Builder {

        private final Map<String, Integer> counts = new LinkedHashMap<>();
        private final Map<String, String> categoryIds = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Add a category. A zero count is dropped, since an empty category
         * is not tracked.
         */
        public Builder category(String name, String categoryId, int count) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Category name cannot be blank");
            }
            if (count < 0) {
                throw new IllegalArgumentException("Category count cannot be negative: " + name);
            }
            if (count == 0) {
                return this;
            }
            if (categoryId == null || categoryId.isBlank()) {
                throw new IllegalArgumentException("Category id cannot be blank: " + name);
            }
            counts.put(name, count);
            categoryIds.put(name, categoryId);
            return this;
        }

        public CatalogIndex build() {
            if (counts.isEmpty()) {
                return EMPTY;
            }
            return new CatalogIndex(
                    Collections.unmodifiableMap(new LinkedHashMap<>(counts)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(categoryIds)));
        }
    }
}
