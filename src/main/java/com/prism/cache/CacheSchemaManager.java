package com.prism.cache;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the cache schema and the cache record table on startup.
 */
@Component
public class CacheSchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(CacheSchemaManager.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String schema;
    private final boolean enabled;

    public CacheSchemaManager(@Qualifier("cacheJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
                              @Value("${prism.storage.cache.schema:ql}") String schema,
                              @Value("${prism.storage.cache.initialize-schema:true}") boolean enabled) {
        if (!JdbcViewCacheStore.IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid cache schema name: " + schema);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.schema = schema;
        this.enabled = enabled;
    }

    @PostConstruct
    public void createTables() {
        if (!enabled) {
            logger.info("Cache schema initialization disabled");
            return;
        }
        jdbcTemplate.getJdbcOperations().execute("CREATE SCHEMA IF NOT EXISTS " + schema);
        jdbcTemplate.getJdbcOperations().execute(logViewsTableSql());
        logger.info("Cache schema {} initialized", schema);
    }

    String logViewsTableSql() {
        return """
            CREATE TABLE IF NOT EXISTS %s.log_views (
                view_id serial PRIMARY KEY,
                log_type text NOT NULL,
                customer_id bigint NOT NULL,
                view_hash text NOT NULL,
                athena_query text NOT NULL,
                last_loaded_at timestamptz,
                created_at timestamptz NOT NULL DEFAULT now(),
                UNIQUE (log_type, customer_id, view_hash)
            )
            """.formatted(schema);
    }
}
