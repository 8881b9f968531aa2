package com.prism.cache;

import java.util.Optional;

/**
 * Persistence port for cache records and their physical tables.
 */
public interface ViewCacheStore {

    /**
     * Find the cache id registered for {@code key}
     */
    Optional<Long> findCacheId(CacheKey key);

    /**
     * Atomically insert the metadata row for {@code key} and create its physical
     * table. The insert must tolerate a concurrent duplicate: when another writer
     * already holds the key, nothing is created and the result is empty.
     *
     * @param key cache record key
     * @param schema physical layout of the table to create
     * @param extractionQuery compiled extraction query persisted with the record
     * @return the new cache id, or empty if the key already existed
     */
    Optional<Long> createIfAbsent(CacheKey key, CacheTableSchema schema, String extractionQuery);
}
