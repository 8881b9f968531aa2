package com.prism.cache;

import com.prism.catalog.ColumnSpec;
import com.prism.catalog.LogTypeCatalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Physical layout of a cache table, derived from its cache columns.
 *
 * Layout: synthetic {@code id}, mandatory {@code date} and {@code hour}, then the
 * non-aggregate columns followed by the aggregate columns, each in name order and
 * typed by the catalog's {@code storageType}.
 */
public class CacheTableSchema {

    static final String TABLE_PREFIX = "log_view_";

    private final List<CacheColumnDefinition> groupingColumns;
    private final List<CacheColumnDefinition> aggregateColumns;

    private CacheTableSchema(List<CacheColumnDefinition> groupingColumns, List<CacheColumnDefinition> aggregateColumns) {
        this.groupingColumns = Collections.unmodifiableList(groupingColumns);
        this.aggregateColumns = Collections.unmodifiableList(aggregateColumns);
    }

    public static CacheTableSchema derive(LogTypeCatalog logType, Collection<String> cacheColumns) {
        List<CacheColumnDefinition> grouping = new ArrayList<>();
        List<CacheColumnDefinition> aggregates = new ArrayList<>();

        for (String name : new TreeSet<>(cacheColumns)) {
            if (LogTypeCatalog.isTimePartitionColumn(name)) {
                continue;
            }
            ColumnSpec column = logType.findColumn(name)
                .orElseThrow(() -> new IllegalArgumentException(
                    String.format("Unknown cache column '%s' for log type '%s'", name, logType.getId())));
            if (column.getStorageType() == null) {
                throw new IllegalArgumentException(
                    String.format("Cache column '%s' of log type '%s' has no storage type", name, logType.getId()));
            }
            CacheColumnDefinition definition = new CacheColumnDefinition(name, column.getStorageType());
            if (column.isAggregate()) {
                aggregates.add(definition);
            } else {
                grouping.add(definition);
            }
        }
        return new CacheTableSchema(grouping, aggregates);
    }

    public static String tableName(String schema, long cacheId) {
        return schema + "." + TABLE_PREFIX + cacheId;
    }

    public List<CacheColumnDefinition> getGroupingColumns() {
        return groupingColumns;
    }

    public List<CacheColumnDefinition> getAggregateColumns() {
        return aggregateColumns;
    }

    public String createTableSql(String schema, long cacheId) {
        List<String> definitions = new ArrayList<>();
        definitions.add("id serial PRIMARY KEY");
        definitions.add("\"date\" date NOT NULL");
        definitions.add("hour smallint NOT NULL");
        groupingColumns.forEach(column -> definitions.add(column.toSql()));
        aggregateColumns.forEach(column -> definitions.add(column.toSql()));

        return "CREATE TABLE IF NOT EXISTS " + tableName(schema, cacheId)
            + " (" + String.join(", ", definitions) + ")";
    }
}
