package com.prism.tenant;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the tenant directory database connection (read only).
 */
@Configuration
public class DirectoryStorageConfig {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryStorageConfig.class);

    @Value("${prism.storage.directory.url:jdbc:postgresql://localhost:5432/directory}")
    private String url;

    @Value("${prism.storage.directory.username:prism}")
    private String username;

    @Value("${prism.storage.directory.password:}")
    private String password;

    @Value("${prism.storage.directory.pool.size:5}")
    private int poolSize;

    @Bean(name = "directoryDataSource")
    public DataSource directoryDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("org.postgresql.Driver");
        config.setPoolName("prism-directory");
        config.setReadOnly(true);

        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setInitializationFailTimeout(-1);

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("Tenant directory DataSource initialized: {}", url);
        return dataSource;
    }

    @Bean(name = "directoryJdbcTemplate")
    public NamedParameterJdbcTemplate directoryJdbcTemplate(@Qualifier("directoryDataSource") DataSource directoryDataSource) {
        return new NamedParameterJdbcTemplate(directoryDataSource);
    }
}
