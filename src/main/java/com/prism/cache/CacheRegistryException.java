package com.prism.cache;

/**
 * Thrown when a cache record could not be looked up or created.
 */
public class CacheRegistryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CacheRegistryException(String message) {
        super(message);
    }

    public CacheRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
