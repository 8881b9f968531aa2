package com.prism.error;

/**
 * Exception thrown when a caller asks for a tenant it may not see.
 *
 * Raised in two situations:
 * - the tenant is outside the caller's tenant scope
 * - the tenant directory resolves no owning tenant for the request
 *
 * The API layer reports it as 403 Forbidden.
 */
public class ViewAccessDeniedException extends ViewPlanningException {

    private static final long serialVersionUID = 1L;

    private final long tenantId;

    public ViewAccessDeniedException(long tenantId, String message) {
        super(message, ErrorCode.ACCESS_DENIED);
        this.tenantId = tenantId;
    }

    public long getTenantId() {
        return tenantId;
    }
}
