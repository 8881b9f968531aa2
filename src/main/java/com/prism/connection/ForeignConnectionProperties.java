package com.prism.connection;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Foreign connection settings, keyed by connection id:
 * <pre>
 * prism:
 *   foreign-connections:
 *     locus_atom_fdw:
 *       host: atom-db
 *       database: atom
 *       username: reader
 *       password: ...
 * </pre>
 */
@ConfigurationProperties(prefix = "prism")
public class ForeignConnectionProperties {

    private Map<String, Connection> foreignConnections = new LinkedHashMap<>();

    public Map<String, Connection> getForeignConnections() {
        return foreignConnections;
    }

    public void setForeignConnections(Map<String, Connection> foreignConnections) {
        this.foreignConnections = foreignConnections;
    }

    public static class Connection {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;
        private int connectTimeoutSeconds = 10;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        @Override
        public String toString() {
            return "Connection{host='" + host + "', port=" + port + ", database='" + database + "'}";
        }
    }
}
