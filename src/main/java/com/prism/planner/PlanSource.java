package com.prism.planner;

/**
 * Where a planned view reads its rows from.
 */
public class PlanSource {

    public enum Kind {
        FAST_VIEW,
        CACHE
    }

    private final Kind kind;
    private final String id;

    private PlanSource(Kind kind, String id) {
        this.kind = kind;
        this.id = id;
    }

    public static PlanSource fastView(String fastViewId) {
        return new PlanSource(Kind.FAST_VIEW, fastViewId);
    }

    public static PlanSource cache(long cacheId) {
        return new PlanSource(Kind.CACHE, Long.toString(cacheId));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Fast view id, or the cache id as text
     */
    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
