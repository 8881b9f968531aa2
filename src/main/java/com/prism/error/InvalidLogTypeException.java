package com.prism.error;

/**
 * The requested log type is not registered in the catalog.
 */
public class InvalidLogTypeException extends ViewPlanningException {

    private static final long serialVersionUID = 1L;

    private final String logType;

    public InvalidLogTypeException(String logType) {
        super(String.format("Invalid log type: %s", logType), ErrorCode.INVALID_LOG_TYPE);
        this.logType = logType;
    }

    public String getLogType() {
        return logType;
    }
}
