package com.prism.query;

import com.prism.catalog.AccessTier;
import com.prism.catalog.ColumnSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the columns a request references and classifies them.
 *
 * The tree is walked breadth-first. A column leaf counts only when it names
 * {@code viewId} and a column present in the catalog; a leaf naming another view
 * is walked like opaque payload:
 * - a column whose tier is above the caller's is dropped without error
 * - otherwise its requested name joins the query columns and raises the minimum tier
 * - a derived column contributes its {@code dependsOn} to the cache columns
 * - any other column contributes its stored name (one alias hop resolved)
 *
 * An alias defers to its target for everything but the tier, so an alias of a
 * derived column contributes the target's dependencies.
 */
@Component
public class ColumnDependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(ColumnDependencyResolver.class);

    public ColumnResolution resolve(String viewId, Map<String, ColumnSpec> columns,
                                    ExpressionNode expressionTree, AccessTier callerTier) {
        Set<String> cacheColumns = new LinkedHashSet<>();
        Set<String> queryColumns = new LinkedHashSet<>();
        AccessTier minTier = AccessTier.PUBLIC;

        Deque<ExpressionNode> queue = new ArrayDeque<>();
        if (expressionTree != null) {
            queue.add(expressionTree);
        }

        while (!queue.isEmpty()) {
            ExpressionNode node = queue.poll();
            switch (node.getKind()) {
                case COLUMN_REF -> {
                    ColumnRef ref = (ColumnRef) node;
                    if (viewId.equals(ref.getView())) {
                        minTier = accept(ref.getColumn(), columns, callerTier, cacheColumns, queryColumns, minTier);
                    } else {
                        queue.addAll(ref.getChildren());
                    }
                }
                case WILDCARD -> {
                    if (viewId.equals(((Wildcard) node).getView())) {
                        for (String name : columns.keySet()) {
                            minTier = accept(name, columns, callerTier, cacheColumns, queryColumns, minTier);
                        }
                    } else {
                        queue.addAll(node.getChildren());
                    }
                }
                case RAW -> queue.addAll(node.getChildren());
            }
        }

        log.debug("Resolved view {}: cacheColumns={}, queryColumns={}, minTier={}",
            viewId, cacheColumns, queryColumns, minTier);
        return new ColumnResolution(cacheColumns, queryColumns, minTier);
    }

    private AccessTier accept(String name, Map<String, ColumnSpec> columns, AccessTier callerTier,
                              Set<String> cacheColumns, Set<String> queryColumns, AccessTier minTier) {
        ColumnSpec column = columns.get(name);
        if (column == null) {
            return minTier;
        }
        AccessTier tier = column.getEffectiveAccessTier();
        if (tier.isAbove(callerTier)) {
            log.debug("Dropping column {} (tier {}) for caller tier {}", name, tier, callerTier);
            return minTier;
        }

        queryColumns.add(name);

        ColumnSpec effective = column;
        String storedName = name;
        if (column.isAlias()) {
            storedName = column.getAliasFor();
            ColumnSpec target = columns.get(storedName);
            if (target != null) {
                effective = target;
            }
        }

        if (effective.isDerived()) {
            cacheColumns.addAll(effective.getDependsOn());
        } else {
            cacheColumns.add(storedName);
        }
        return AccessTier.max(minTier, tier);
    }
}
