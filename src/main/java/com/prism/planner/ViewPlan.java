package com.prism.planner;

import com.prism.lister.ExposedColumn;

import java.util.List;

/**
 * Output of {@link FederatedViewPlanner#planView}.
 *
 * - {@code compiledView}: the query to run against the cache database
 * - {@code exposedColumns}: metadata of the requested columns the caller may see
 * - {@code cacheDependencies}: cache tables the query reads (empty on the fast-view path)
 * - {@code internalOnly}: the view uses columns of internal tier or above
 * - {@code foreignConnections}: connections initialized for the query, distinct
 */
public class ViewPlan {

    private final String viewId;
    private final CompiledView compiledView;
    private final List<ExposedColumn> exposedColumns;
    private final List<Long> cacheDependencies;
    private final boolean internalOnly;
    private final List<String> foreignConnections;
    private final PlanSource source;

    public ViewPlan(String viewId, CompiledView compiledView, List<ExposedColumn> exposedColumns,
                    List<Long> cacheDependencies, boolean internalOnly, List<String> foreignConnections,
                    PlanSource source) {
        this.viewId = viewId;
        this.compiledView = compiledView;
        this.exposedColumns = List.copyOf(exposedColumns);
        this.cacheDependencies = List.copyOf(cacheDependencies);
        this.internalOnly = internalOnly;
        this.foreignConnections = List.copyOf(foreignConnections);
        this.source = source;
    }

    public String getViewId() {
        return viewId;
    }

    public CompiledView getCompiledView() {
        return compiledView;
    }

    public List<ExposedColumn> getExposedColumns() {
        return exposedColumns;
    }

    public List<Long> getCacheDependencies() {
        return cacheDependencies;
    }

    public boolean isInternalOnly() {
        return internalOnly;
    }

    public List<String> getForeignConnections() {
        return foreignConnections;
    }

    public PlanSource getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "ViewPlan{viewId='" + viewId + "', source=" + source + ", internalOnly=" + internalOnly
            + ", foreignConnections=" + foreignConnections + "}";
    }
}
