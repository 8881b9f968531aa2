package com.prism.extraction;

import com.prism.catalog.ColumnSpec;
import com.prism.catalog.LogTypeCatalog;
import com.prism.catalog.OwnerKind;
import com.prism.error.UnknownColumnException;
import com.prism.tenant.TenantIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Compiles the aggregation query that pulls a cache table's columns out of the
 * raw, date/hour partitioned log store.
 *
 * The query always groups by {@code "date"} and {@code hour} first, then by the
 * non-aggregate columns in name order; aggregates follow. Multi-valued columns
 * add their cross join once. Rows are restricted to the owning customer and to a
 * time window left as placeholders ({@link #START_DATE}, {@link #END_DATE},
 * {@link #START_HOUR}, {@link #END_HOUR}) for the extraction scheduler to bind.
 * The window's start is exclusive and its end inclusive.
 */
@Component
public class ExtractionQueryCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionQueryCompiler.class);

    public static final String START_DATE = "[START_DATE]";
    public static final String END_DATE = "[END_DATE]";
    public static final String START_HOUR = "[START_HOUR]";
    public static final String END_HOUR = "[END_HOUR]";

    /**
     * Compile the extraction query for {@code cacheColumns}.
     *
     * The customer filter uses the advertiser id for advertiser-owned log types and
     * the agency id otherwise.
     */
    public String compileExtraction(TenantIdentity identity, LogTypeCatalog logType, Collection<String> cacheColumns) {
        List<String> groupBy = new ArrayList<>(List.of("\"date\"", "hour"));
        List<String> aggregates = new ArrayList<>();
        Set<String> crossJoins = new LinkedHashSet<>();

        for (String name : new TreeSet<>(cacheColumns)) {
            if (LogTypeCatalog.isTimePartitionColumn(name)) {
                continue;
            }
            ColumnSpec column = logType.findColumn(name)
                .orElseThrow(() -> new UnknownColumnException(logType.getId(), name));

            if (column.getCrossJoinClause() != null) {
                crossJoins.add(column.getCrossJoinClause());
            }
            String expression = column.getSourceExpression();
            if (column.isAggregate()) {
                aggregates.add((expression != null ? expression : "SUM(" + quote(name) + ")") + " AS " + quote(name));
            } else {
                groupBy.add(expression != null ? expression + " AS " + quote(name) : quote(name));
            }
        }

        long customerId = logType.getOwnerKind() == OwnerKind.ADVERTISER
            ? identity.getAdvertiserId()
            : identity.getAgencyId();

        List<String> projections = new ArrayList<>(groupBy);
        projections.addAll(aggregates);

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", projections));
        sql.append(" FROM ").append(logType.getSourceTable());
        for (String crossJoin : crossJoins) {
            sql.append(' ').append(crossJoin);
        }
        sql.append(" WHERE customer_id = ").append(customerId);
        sql.append(" AND \"date\" IS NOT NULL AND hour IS NOT NULL");
        sql.append(" AND (").append(windowFilter()).append(")");
        sql.append(" GROUP BY ").append(IntStream.rangeClosed(1, groupBy.size())
            .mapToObj(Integer::toString)
            .collect(Collectors.joining(", ")));

        logger.debug("Compiled extraction for {} customer {}: {} grouping, {} aggregate columns",
            logType.getId(), customerId, groupBy.size(), aggregates.size());
        return sql.toString();
    }

    /**
     * Half-open window filter, {@code (start, end]}. A window that starts and ends
     * on the same day only matches hours of that day inside the window.
     */
    static String windowFilter() {
        String startDate = "date '" + START_DATE + "'";
        String endDate = "date '" + END_DATE + "'";
        String multiDay = startDate + " < " + endDate;
        return "\"date\" > " + startDate + " AND \"date\" < " + endDate
            + " OR " + multiDay + " AND " + START_HOUR + " < 23 AND \"date\" = " + startDate
            + " AND hour > " + START_HOUR
            + " OR " + multiDay + " AND \"date\" = " + endDate
            + " AND (" + END_HOUR + " = 23 OR hour <= " + END_HOUR + ")"
            + " OR " + startDate + " = " + endDate + " AND \"date\" = " + endDate
            + " AND hour > " + START_HOUR + " AND hour <= " + END_HOUR;
    }

    private static String quote(String name) {
        return "\"" + name + "\"";
    }
}
