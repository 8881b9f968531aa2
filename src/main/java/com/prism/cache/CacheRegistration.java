package com.prism.cache;

/**
 * Result of {@link ViewCacheRegistry#lookupOrCreate}.
 */
public class CacheRegistration {

    private final long cacheId;
    private final ViewFingerprint fingerprint;
    private final boolean created;
    private final int attempts;

    public CacheRegistration(long cacheId, ViewFingerprint fingerprint, boolean created, int attempts) {
        this.cacheId = cacheId;
        this.fingerprint = fingerprint;
        this.created = created;
        this.attempts = attempts;
    }

    public long getCacheId() {
        return cacheId;
    }

    public ViewFingerprint getFingerprint() {
        return fingerprint;
    }

    /**
     * True when this call inserted the record and created the table
     */
    public boolean isCreated() {
        return created;
    }

    /**
     * Number of lookup/insert rounds it took; above one means a concurrent writer won a round
     */
    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "CacheRegistration{cacheId=" + cacheId + ", fingerprint=" + fingerprint
            + ", created=" + created + ", attempts=" + attempts + "}";
    }
}
