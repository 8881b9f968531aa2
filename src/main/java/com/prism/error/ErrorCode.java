package com.prism.error;

/**
 * Caller-facing failure classes of view planning.
 *
 * Every code is non-retryable: the request itself has to change before it can
 * succeed. The HTTP status is the one the API layer reports for the code.
 */
public enum ErrorCode {

    INVALID_LOG_TYPE(400),
    ACCESS_DENIED(403),
    COLUMN_COUNT_OUT_OF_BOUNDS(400),
    UNKNOWN_COLUMN(400),
    INVALID_VIEW_IDENTIFIER(400);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return false;
    }
}
