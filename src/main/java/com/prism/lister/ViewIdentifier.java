package com.prism.lister;

import com.prism.catalog.LogTypeCatalog;
import com.prism.error.InvalidViewIdentifierException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opaque view identifier {@code logs_<logType>_<tenantId>}.
 */
public final class ViewIdentifier {

    public static final String VIEW_TYPE = "logs";

    private static final Pattern PATTERN = Pattern.compile(
        "^" + VIEW_TYPE + "_(" + LogTypeCatalog.ID_REGEX + ")_(\\d+)$");

    private final String logType;
    private final long tenantId;

    private ViewIdentifier(String logType, long tenantId) {
        this.logType = logType;
        this.tenantId = tenantId;
    }

    public static ViewIdentifier of(String logType, long tenantId) {
        return new ViewIdentifier(Objects.requireNonNull(logType, "logType"), tenantId);
    }

    public static String format(String logType, long tenantId) {
        return VIEW_TYPE + "_" + logType + "_" + tenantId;
    }

    /**
     * Parse an identifier; the tenant id must be a positive number
     *
     * @throws InvalidViewIdentifierException if the identifier does not match
     */
    public static ViewIdentifier parse(String viewId) {
        if (viewId == null) {
            throw new InvalidViewIdentifierException(null);
        }
        Matcher matcher = PATTERN.matcher(viewId);
        if (!matcher.matches()) {
            throw new InvalidViewIdentifierException(viewId);
        }
        long tenantId;
        try {
            tenantId = Long.parseLong(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidViewIdentifierException(viewId);
        }
        if (tenantId <= 0) {
            throw new InvalidViewIdentifierException(viewId);
        }
        return new ViewIdentifier(matcher.group(1), tenantId);
    }

    public String getLogType() {
        return logType;
    }

    public long getTenantId() {
        return tenantId;
    }

    public String getId() {
        return format(logType, tenantId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ViewIdentifier that = (ViewIdentifier) o;
        return tenantId == that.tenantId && logType.equals(that.logType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logType, tenantId);
    }

    @Override
    public String toString() {
        return getId();
    }
}
