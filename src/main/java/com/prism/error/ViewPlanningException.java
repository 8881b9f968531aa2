package com.prism.error;

/**
 * Base class for request errors raised while planning or describing a view.
 *
 * Infrastructure failures (storage, tenant directory, foreign connections) are
 * not modelled here; they surface as their own exceptions and fail the whole call.
 *
 * @see ErrorCode
 */
public class ViewPlanningException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;

    public ViewPlanningException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.getHttpStatus();
    }
}
