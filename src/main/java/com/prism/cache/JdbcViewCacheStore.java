package com.prism.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * PostgreSQL-backed cache record store.
 *
 * Records live in {@code <schema>.log_views}, unique on
 * {@code (log_type, customer_id, view_hash)}. Creation inserts with
 * {@code ON CONFLICT DO NOTHING RETURNING view_id} and creates the
 * {@code <schema>.log_view_<id>} table in the same transaction, so a record never
 * exists without its table.
 */
@Repository
public class JdbcViewCacheStore implements ViewCacheStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcViewCacheStore.class);

    static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String schema;

    public JdbcViewCacheStore(@Qualifier("cacheJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
                              @Qualifier("cacheTransactionTemplate") TransactionTemplate transactionTemplate,
                              @Value("${prism.storage.cache.schema:ql}") String schema) {
        if (!IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid cache schema name: " + schema);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.schema = schema;
    }

    @Override
    public Optional<Long> findCacheId(CacheKey key) {
        String sql = """
            SELECT view_id
            FROM %s.log_views
            WHERE log_type = :logType
              AND customer_id = :tenantId
              AND view_hash = :viewHash
            """.formatted(schema);

        List<Long> ids = jdbcTemplate.queryForList(sql, keyParameters(key), Long.class);
        return ids.isEmpty() ? Optional.empty() : Optional.ofNullable(ids.get(0));
    }

    @Override
    public Optional<Long> createIfAbsent(CacheKey key, CacheTableSchema tableSchema, String extractionQuery) {
        String sql = """
            INSERT INTO %s.log_views
                (log_type, customer_id, view_hash, athena_query)
            VALUES
                (:logType, :tenantId, :viewHash, :extractionQuery)
            ON CONFLICT (log_type, customer_id, view_hash) DO NOTHING
            RETURNING view_id
            """.formatted(schema);

        MapSqlParameterSource parameters = keyParameters(key).addValue("extractionQuery", extractionQuery);

        Optional<Long> result = transactionTemplate.execute(status -> {
            List<Long> ids = jdbcTemplate.queryForList(sql, parameters, Long.class);
            if (ids.isEmpty()) {
                return Optional.empty();
            }
            long cacheId = ids.get(0);
            jdbcTemplate.getJdbcOperations().execute(tableSchema.createTableSql(schema, cacheId));
            logger.debug("Inserted cache record {} for {}", cacheId, key);
            return Optional.of(cacheId);
        });
        return result == null ? Optional.empty() : result;
    }

    private MapSqlParameterSource keyParameters(CacheKey key) {
        return new MapSqlParameterSource()
            .addValue("logType", key.getLogType())
            .addValue("tenantId", key.getTenantId())
            .addValue("viewHash", key.getFingerprint().getValue());
    }
}
