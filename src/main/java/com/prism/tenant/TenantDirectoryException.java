package com.prism.tenant;

/**
 * Thrown when the tenant directory cannot be read.
 */
public class TenantDirectoryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TenantDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
