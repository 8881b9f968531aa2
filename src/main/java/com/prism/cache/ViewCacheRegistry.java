package com.prism.cache;

import com.prism.catalog.LogTypeCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Content-addressed registry of durable cache tables.
 *
 * {@code lookupOrCreate} converges concurrent callers on one cache id per
 * (log type, tenant, fingerprint) without locks:
 * <ol>
 *   <li>look up the existing record</li>
 *   <li>otherwise insert it with a conflict-tolerant insert and create the table,
 *       both in one transaction (see {@link ViewCacheStore#createIfAbsent})</li>
 *   <li>if the insert was a no-op another caller won; read the winner's id</li>
 * </ol>
 * The loop runs at most {@code prism.planner.cache-registry.max-attempts} rounds.
 * The extraction query is compiled only when this caller actually inserts.
 */
@Service
public class ViewCacheRegistry {

    private static final Logger log = LoggerFactory.getLogger(ViewCacheRegistry.class);

    private final ViewCacheStore store;
    private final int maxAttempts;

    public ViewCacheRegistry(ViewCacheStore store,
                             @Value("${prism.planner.cache-registry.max-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        this.store = store;
        this.maxAttempts = maxAttempts;
    }

    public Mono<CacheRegistration> lookupOrCreate(LogTypeCatalog logType, long tenantId,
                                                  Collection<String> cacheColumns,
                                                  Supplier<String> extractionQuery) {
        return Mono.fromCallable(() -> register(logType, tenantId, cacheColumns, extractionQuery))
            .subscribeOn(Schedulers.boundedElastic());
    }

    CacheRegistration register(LogTypeCatalog logType, long tenantId,
                               Collection<String> cacheColumns, Supplier<String> extractionQuery) {
        ViewFingerprint fingerprint = ViewFingerprint.of(cacheColumns);
        CacheKey key = new CacheKey(logType.getId(), tenantId, fingerprint);
        log.debug("Cache lookup for {} columns={}", key, fingerprint.getColumns());

        CacheTableSchema schema = null;
        String query = null;

        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                Optional<Long> existing = store.findCacheId(key);
                if (existing.isPresent()) {
                    return new CacheRegistration(existing.get(), fingerprint, false, attempt);
                }

                if (schema == null) {
                    schema = CacheTableSchema.derive(logType, cacheColumns);
                    query = extractionQuery.get();
                }

                Optional<Long> created = store.createIfAbsent(key, schema, query);
                if (created.isPresent()) {
                    log.info("Created cache table {} for {}", CacheTableSchema.TABLE_PREFIX + created.get(), key);
                    return new CacheRegistration(created.get(), fingerprint, true, attempt);
                }
                log.debug("Concurrent registration of {} on attempt {}, re-reading", key, attempt);
            }
        } catch (DataAccessException e) {
            log.error("Cache registry storage failure for {}", key, e);
            throw new CacheRegistryException("Cache registry storage failure for " + key, e);
        }

        throw new CacheRegistryException(
            String.format("Cache record for %s did not converge after %d attempts", key, maxAttempts));
    }
}
