package com.prism.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cache record store with the same insert-if-absent contract as the
 * database: at most one record, and one table, per key.
 */
public class InMemoryViewCacheStore implements ViewCacheStore {

    private final Map<CacheKey, Long> records = new ConcurrentHashMap<>();
    private final Map<Long, String> extractionQueries = new ConcurrentHashMap<>();
    private final Map<Long, CacheTableSchema> tables = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger createAttempts = new AtomicInteger();

    @Override
    public Optional<Long> findCacheId(CacheKey key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public Optional<Long> createIfAbsent(CacheKey key, CacheTableSchema schema, String extractionQuery) {
        createAttempts.incrementAndGet();
        long candidate = sequence.incrementAndGet();
        Long existing = records.putIfAbsent(key, candidate);
        if (existing != null) {
            return Optional.empty();
        }
        extractionQueries.put(candidate, extractionQuery);
        tables.put(candidate, schema);
        return Optional.of(candidate);
    }

    public int getRecordCount() {
        return records.size();
    }

    public int getTableCount() {
        return tables.size();
    }

    public int getCreateAttempts() {
        return createAttempts.get();
    }

    public String getExtractionQuery(long cacheId) {
        return extractionQueries.get(cacheId);
    }

    public CacheTableSchema getTable(long cacheId) {
        return tables.get(cacheId);
    }
}
