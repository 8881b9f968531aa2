package com.prism.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Column catalog of one log type.
 *
 * Column names are unique within a catalog and every {@code dependsOn} or
 * {@code aliasFor} target lives in the same catalog (see {@link CatalogValidator}).
 */
public class LogTypeCatalog {

    /**
     * Intrinsic time-partition columns. Every cache table and extraction query
     * carries {@code date} and {@code hour}, so these never count as cache columns.
     */
    public static final Set<String> TIME_PARTITION_COLUMNS = Set.of("date", "_date", "hour", "_hour");

    /**
     * Log type ids are embedded in view identifiers, which only allow lowercase letters
     */
    public static final String ID_REGEX = "[a-z]+";

    private static final Pattern ID_PATTERN = Pattern.compile(ID_REGEX);

    private final String id;
    private final String displayName;
    private final String category;
    private final String sourceTable;
    private final OwnerKind ownerKind;
    private final Map<String, ColumnSpec> columns;

    public LogTypeCatalog(String id, String displayName, String category, String sourceTable,
                          OwnerKind ownerKind, Map<String, ColumnSpec> columns) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = displayName == null ? id : displayName;
        this.category = category;
        this.sourceTable = Objects.requireNonNull(sourceTable, "sourceTable");
        this.ownerKind = ownerKind == null ? OwnerKind.AGENCY : ownerKind;
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Listing category of the log type, used to filter view listings
     */
    public String getCategory() {
        return category;
    }

    public String getSourceTable() {
        return sourceTable;
    }

    public OwnerKind getOwnerKind() {
        return ownerKind;
    }

    public Map<String, ColumnSpec> getColumns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Optional<ColumnSpec> findColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    /**
     * The spec that drives a column's behaviour: the alias target for alias
     * columns, the column itself otherwise.
     */
    public ColumnSpec effectiveSpec(ColumnSpec column) {
        if (!column.isAlias()) {
            return column;
        }
        ColumnSpec target = columns.get(column.getAliasFor());
        if (target == null) {
            throw new IllegalStateException(String.format(
                "Column '%s' of log type '%s' aliases unknown column '%s'", column.getName(), id, column.getAliasFor()));
        }
        return target;
    }

    /**
     * Name of the stored column backing {@code column}: the alias target or the column itself
     */
    public String storedName(ColumnSpec column) {
        return column.isAlias() ? column.getAliasFor() : column.getName();
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    public static boolean isTimePartitionColumn(String name) {
        return TIME_PARTITION_COLUMNS.contains(name);
    }

    @Override
    public String toString() {
        return "LogTypeCatalog{id='" + id + "', sourceTable='" + sourceTable + "', columns=" + columns.size() + "}";
    }
}
