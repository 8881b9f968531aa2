package com.prism.error;

/**
 * The resolved cache-column count is zero or exceeds the configured maximum.
 */
public class ColumnCountOutOfBoundsException extends ViewPlanningException {

    private static final long serialVersionUID = 1L;

    private final String logType;
    private final int columnCount;
    private final int maxColumns;

    public ColumnCountOutOfBoundsException(String logType, int columnCount, int maxColumns) {
        super(String.format(
                "Log views are restricted to queries pulling between 1 and %d columns (log type '%s' resolved %d)",
                maxColumns, logType, columnCount),
            ErrorCode.COLUMN_COUNT_OUT_OF_BOUNDS);
        this.logType = logType;
        this.columnCount = columnCount;
        this.maxColumns = maxColumns;
    }

    public String getLogType() {
        return logType;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public int getMaxColumns() {
        return maxColumns;
    }
}
