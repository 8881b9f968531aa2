package com.prism.planner;

import java.util.List;

/**
 * Final SQL of a planned view with its positional ({@code ?}) bindings.
 */
public class CompiledView {

    private final String sql;
    private final List<Object> bindings;

    public CompiledView(String sql, List<Object> bindings) {
        this.sql = sql;
        this.bindings = List.copyOf(bindings);
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getBindings() {
        return bindings;
    }

    @Override
    public String toString() {
        return sql + (bindings.isEmpty() ? "" : " " + bindings);
    }
}
