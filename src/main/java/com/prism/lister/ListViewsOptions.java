package com.prism.lister;

import java.util.Collection;
import java.util.Set;

/**
 * Options of {@link ViewCatalogLister#listViews}.
 */
public class ListViewsOptions {

    private static final ListViewsOptions DEFAULTS = new ListViewsOptions(null, true);

    private final Set<String> categories;
    private final boolean includeColumns;

    private ListViewsOptions(Set<String> categories, boolean includeColumns) {
        this.categories = categories;
        this.includeColumns = includeColumns;
    }

    /**
     * All categories, with column metadata
     */
    public static ListViewsOptions defaults() {
        return DEFAULTS;
    }

    public ListViewsOptions withCategories(Collection<String> categories) {
        return new ListViewsOptions(categories == null ? null : Set.copyOf(categories), includeColumns);
    }

    public ListViewsOptions withColumns(boolean includeColumns) {
        return new ListViewsOptions(categories, includeColumns);
    }

    public boolean matchesCategory(String category) {
        return categories == null || categories.contains(category);
    }

    public boolean isIncludeColumns() {
        return includeColumns;
    }
}
