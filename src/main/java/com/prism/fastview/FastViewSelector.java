package com.prism.fastview;

import com.prism.catalog.ColumnSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Finds the precomputed fast views that hold every required cache column.
 *
 * The result is the intersection of the columns' {@code fastViewCandidates},
 * in the order of the first column's list (ascending cardinality). A column
 * with no candidates, or an intersection that runs empty, yields an empty
 * list: the request has to go through the durable cache.
 */
@Component
public class FastViewSelector {

    private static final Logger log = LoggerFactory.getLogger(FastViewSelector.class);

    public List<String> selectFastViews(Map<String, ColumnSpec> columns, Collection<String> cacheColumns) {
        List<String> fastViews = null;

        for (String name : cacheColumns) {
            ColumnSpec column = columns.get(name);
            if (column == null || column.getFastViewCandidates().isEmpty()) {
                log.debug("No fast view covers column {}", name);
                return List.of();
            }
            if (fastViews == null) {
                fastViews = new ArrayList<>(column.getFastViewCandidates());
            } else {
                fastViews.retainAll(column.getFastViewCandidates());
            }
            if (fastViews.isEmpty()) {
                return List.of();
            }
        }

        return fastViews == null ? List.of() : List.copyOf(fastViews);
    }
}
