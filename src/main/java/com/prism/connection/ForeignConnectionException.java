package com.prism.connection;

/**
 * Thrown when a foreign connection cannot be initialized.
 * The message names the connection only, never its credentials.
 */
public class ForeignConnectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String connectionId;

    public ForeignConnectionException(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }

    public ForeignConnectionException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
