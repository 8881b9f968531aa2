package com.prism.cache;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the PostgreSQL cache store connection.
 * Holds the cache record table and the per-view cache tables.
 */
@Configuration
public class CacheStorageConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheStorageConfig.class);

    @Value("${prism.storage.cache.url:jdbc:postgresql://localhost:5432/prism}")
    private String url;

    @Value("${prism.storage.cache.username:prism}")
    private String username;

    @Value("${prism.storage.cache.password:}")
    private String password;

    @Value("${prism.storage.cache.pool.size:10}")
    private int poolSize;

    /**
     * Create the cache DataSource with connection pooling
     */
    @Bean(name = "cacheDataSource")
    @Primary
    public DataSource cacheDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("org.postgresql.Driver");
        config.setPoolName("prism-cache");

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);

        // Fail at first use, not at startup
        config.setInitializationFailTimeout(-1);

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("Cache DataSource initialized: {}", url);
        return dataSource;
    }

    @Bean(name = "cacheJdbcTemplate")
    public NamedParameterJdbcTemplate cacheJdbcTemplate(@Qualifier("cacheDataSource") DataSource cacheDataSource) {
        return new NamedParameterJdbcTemplate(cacheDataSource);
    }

    /**
     * Transactions spanning the cache record insert and the table DDL
     */
    @Bean(name = "cacheTransactionTemplate")
    public TransactionTemplate cacheTransactionTemplate(@Qualifier("cacheDataSource") DataSource cacheDataSource) {
        return new TransactionTemplate(new DataSourceTransactionManager(cacheDataSource));
    }
}
