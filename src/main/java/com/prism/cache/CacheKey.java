package com.prism.cache;

import java.util.Objects;

/**
 * Unique key of a cache record: one physical cache table exists per key.
 */
public class CacheKey {

    private final String logType;
    private final long tenantId;
    private final ViewFingerprint fingerprint;

    public CacheKey(String logType, long tenantId, ViewFingerprint fingerprint) {
        this.logType = Objects.requireNonNull(logType, "logType");
        this.tenantId = tenantId;
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public String getLogType() {
        return logType;
    }

    public long getTenantId() {
        return tenantId;
    }

    public ViewFingerprint getFingerprint() {
        return fingerprint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return tenantId == cacheKey.tenantId
            && logType.equals(cacheKey.logType)
            && fingerprint.equals(cacheKey.fingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logType, tenantId, fingerprint);
    }

    @Override
    public String toString() {
        return logType + "/" + tenantId + "/" + fingerprint;
    }
}
