package com.prism.query;

import com.prism.catalog.AccessTier;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of resolving a request against a column catalog.
 *
 * {@code cacheColumns} are the stored columns that must be extracted or read;
 * {@code queryColumns} are the names as the caller asked for them. Both keep first
 * encounter order.
 */
public class ColumnResolution {

    private final Set<String> cacheColumns;
    private final Set<String> queryColumns;
    private final AccessTier minAccessTier;

    public ColumnResolution(Set<String> cacheColumns, Set<String> queryColumns, AccessTier minAccessTier) {
        this.cacheColumns = Collections.unmodifiableSet(new LinkedHashSet<>(cacheColumns));
        this.queryColumns = Collections.unmodifiableSet(new LinkedHashSet<>(queryColumns));
        this.minAccessTier = minAccessTier;
    }

    public Set<String> getCacheColumns() {
        return cacheColumns;
    }

    public Set<String> getQueryColumns() {
        return queryColumns;
    }

    /**
     * Highest tier among the resolved query columns, PUBLIC when none declares one
     */
    public AccessTier getMinAccessTier() {
        return minAccessTier;
    }

    @Override
    public String toString() {
        return "ColumnResolution{cacheColumns=" + cacheColumns + ", queryColumns=" + queryColumns
            + ", minAccessTier=" + minAccessTier + "}";
    }
}
