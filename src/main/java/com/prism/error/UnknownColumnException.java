package com.prism.error;

/**
 * A resolved cache column is missing from the log type's catalog.
 *
 * Only reachable when the catalog's dependency or alias targets are broken,
 * kept as a distinct code so the offending column can be diagnosed.
 */
public class UnknownColumnException extends ViewPlanningException {

    private static final long serialVersionUID = 1L;

    private final String logType;
    private final String column;

    public UnknownColumnException(String logType, String column) {
        super(String.format("Unknown column '%s' for log type: %s", column, logType),
            ErrorCode.UNKNOWN_COLUMN);
        this.logType = logType;
        this.column = column;
    }

    public String getLogType() {
        return logType;
    }

    public String getColumn() {
        return column;
    }
}
