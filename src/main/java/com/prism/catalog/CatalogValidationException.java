package com.prism.catalog;

import java.util.List;

/**
 * Thrown at startup when catalog configuration violates a catalog invariant.
 */
public class CatalogValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public CatalogValidationException(List<String> violations) {
        super("Invalid catalog: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public CatalogValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
