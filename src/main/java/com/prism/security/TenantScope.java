package com.prism.security;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A set of tenant (or partner) ids a caller is limited to, or no limit at all.
 */
public final class TenantScope {

    private static final TenantScope UNRESTRICTED = new TenantScope(null);

    private final Set<Long> ids;

    private TenantScope(Set<Long> ids) {
        this.ids = ids;
    }

    public static TenantScope unrestricted() {
        return UNRESTRICTED;
    }

    public static TenantScope of(Collection<Long> ids) {
        return new TenantScope(Collections.unmodifiableSet(new TreeSet<>(ids)));
    }

    public static TenantScope of(long... ids) {
        Set<Long> set = new TreeSet<>();
        for (long id : ids) {
            set.add(id);
        }
        return new TenantScope(Collections.unmodifiableSet(set));
    }

    public boolean isUnrestricted() {
        return ids == null;
    }

    public boolean contains(long id) {
        return ids == null || ids.contains(id);
    }

    /**
     * The ids of a restricted scope, sorted; empty for an unrestricted scope
     */
    public Set<Long> getIds() {
        return ids == null ? Set.of() : ids;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TenantScope that = (TenantScope) o;
        return ids == null ? that.ids == null : ids.equals(that.ids);
    }

    @Override
    public int hashCode() {
        return ids == null ? 0 : ids.hashCode() + 1;
    }

    @Override
    public String toString() {
        return ids == null ? "unrestricted" : ids.toString();
    }
}
