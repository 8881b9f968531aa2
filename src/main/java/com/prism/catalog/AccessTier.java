package com.prism.catalog;

/**
 * Ordered sensitivity levels gating column visibility.
 *
 * A caller at a given tier sees every column whose tier is at or below its own.
 */
public enum AccessTier {

    /**
     * Visible to everyone; also the tier of columns that declare none
     */
    PUBLIC(0),

    /**
     * Customer-facing columns (white-label and customer users)
     */
    CUSTOMER(1),

    /**
     * Internal staff only
     */
    INTERNAL(2),

    /**
     * Never exposed to the UI
     */
    PRIVATE(3);

    private final int level;

    AccessTier(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAbove(AccessTier other) {
        return level > other.level;
    }

    public static AccessTier max(AccessTier a, AccessTier b) {
        return a.level >= b.level ? a : b;
    }
}
