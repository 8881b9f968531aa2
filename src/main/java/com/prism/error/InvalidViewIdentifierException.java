package com.prism.error;

/**
 * A view identifier did not match the {@code logs_<logType>_<tenantId>} pattern.
 */
public class InvalidViewIdentifierException extends ViewPlanningException {

    private static final long serialVersionUID = 1L;

    private final String viewId;

    public InvalidViewIdentifierException(String viewId) {
        super(String.format("Invalid view: %s", viewId), ErrorCode.INVALID_VIEW_IDENTIFIER);
        this.viewId = viewId;
    }

    public String getViewId() {
        return viewId;
    }
}
