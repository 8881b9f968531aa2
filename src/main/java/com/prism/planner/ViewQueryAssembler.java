package com.prism.planner;

import com.prism.cache.CacheTableSchema;
import com.prism.catalog.ResolvedSourceView;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the final SQL of a planned view.
 *
 * The planned source is always aliased {@code log}. Grouping projections come
 * first and are grouped by position; aggregate projections follow. Usage:
 * <pre>
 * CompiledView view = new ViewQueryAssembler()
 *     .from(ViewQueryAssembler.fastViewSource(fastView))
 *     .groupBy("log.\"os_id\" AS \"os_id\"")
 *     .aggregate("SUM(log.\"impressions\") AS \"impressions\"")
 *     .join(joinClause)
 *     .build();
 * </pre>
 */
public class ViewQueryAssembler {

    public static final String SOURCE_ALIAS = "log";

    private final List<String> groupingProjections = new ArrayList<>();
    private final List<String> aggregateProjections = new ArrayList<>();
    private final List<String> joins = new ArrayList<>();
    private final List<Object> bindings = new ArrayList<>();
    private String source;

    /**
     * Source over a fast view, which already carries {@code time_tz}
     */
    public static String fastViewSource(ResolvedSourceView fastView) {
        return "(SELECT * FROM " + fastView.getSourceExpression() + ") AS " + SOURCE_ALIAS;
    }

    /**
     * Source over a cache table. Adds {@code time_tz}, the stored UTC date and hour
     * re-expressed in the time zone bound to the single placeholder.
     */
    public static String cacheSource(String schema, long cacheId) {
        return "(SELECT *, timezone(?, timezone('UTC', date + hour * INTERVAL '1 hour'))::timestamptz AS time_tz"
            + " FROM " + CacheTableSchema.tableName(schema, cacheId) + ") AS " + SOURCE_ALIAS;
    }

    public ViewQueryAssembler from(String source, Object... sourceBindings) {
        this.source = source;
        this.bindings.addAll(List.of(sourceBindings));
        return this;
    }

    public ViewQueryAssembler groupBy(String projection) {
        groupingProjections.add(projection);
        return this;
    }

    public ViewQueryAssembler aggregate(String projection) {
        aggregateProjections.add(projection);
        return this;
    }

    public ViewQueryAssembler join(String joinClause) {
        joins.add(joinClause);
        return this;
    }

    public CompiledView build() {
        if (source == null) {
            throw new IllegalStateException("No source set");
        }
        List<String> projections = new ArrayList<>(groupingProjections);
        projections.addAll(aggregateProjections);
        if (projections.isEmpty()) {
            throw new IllegalStateException("No projections");
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", projections));
        sql.append(" FROM ").append(source);
        for (String join : joins) {
            sql.append(' ').append(join);
        }
        if (!groupingProjections.isEmpty()) {
            sql.append(" GROUP BY ").append(IntStream.rangeClosed(1, groupingProjections.size())
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(", ")));
        }
        return new CompiledView(sql.toString(), bindings);
    }
}
