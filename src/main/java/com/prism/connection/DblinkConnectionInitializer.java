package com.prism.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens foreign connections with PostgreSQL {@code dblink_connect}.
 *
 * Connections are opened on the cache database, where planned queries run.
 * SQLSTATE {@code 42710} (duplicate object) means the named connection is
 * already open and counts as success.
 */
@Component
public class DblinkConnectionInitializer implements ForeignConnectionInitializer {

    private static final Logger log = LoggerFactory.getLogger(DblinkConnectionInitializer.class);

    static final String ALREADY_CONNECTED = "42710";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ForeignConnectionProperties properties;

    public DblinkConnectionInitializer(@Qualifier("cacheJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate,
                                       ForeignConnectionProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Override
    public Mono<Void> initialize(String connectionId) {
        return Mono.fromRunnable(() -> connect(connectionId))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    void connect(String connectionId) {
        ForeignConnectionProperties.Connection connection = properties.getForeignConnections().get(connectionId);
        if (connection == null) {
            throw new ForeignConnectionException(connectionId,
                "No configuration for foreign connection '" + connectionId + "'");
        }

        MapSqlParameterSource parameters = new MapSqlParameterSource()
            .addValue("name", connectionId)
            .addValue("connstr", connectionString(connection));
        try {
            jdbcTemplate.queryForObject("SELECT dblink_connect(:name, :connstr)", parameters, String.class);
            log.info("Foreign connection {} initialized ({}:{})", connectionId, connection.getHost(), connection.getPort());
        } catch (DataAccessException e) {
            String sqlState = sqlState(e);
            if (ALREADY_CONNECTED.equals(sqlState)) {
                log.debug("Foreign connection {} already open", connectionId);
                return;
            }
            log.error("Failed to initialize foreign connection {} (SQLSTATE {})", connectionId, sqlState);
            throw new ForeignConnectionException(connectionId,
                "Failed to initialize foreign connection '" + connectionId + "'", e);
        }
    }

    /**
     * libpq keyword/value connection string
     */
    static String connectionString(ForeignConnectionProperties.Connection connection) {
        List<String> parts = new ArrayList<>();
        parts.add("host=" + quote(connection.getHost()));
        parts.add("port=" + connection.getPort());
        if (connection.getDatabase() != null) {
            parts.add("dbname=" + quote(connection.getDatabase()));
        }
        if (connection.getUsername() != null) {
            parts.add("user=" + quote(connection.getUsername()));
        }
        if (connection.getPassword() != null) {
            parts.add("password=" + quote(connection.getPassword()));
        }
        parts.add("connect_timeout=" + connection.getConnectTimeoutSeconds());
        return String.join(" ", parts);
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String sqlState(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException) {
                String state = ((SQLException) cause).getSQLState();
                if (state != null) {
                    return state;
                }
            }
        }
        return null;
    }
}
