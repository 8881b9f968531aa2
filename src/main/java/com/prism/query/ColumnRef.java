package com.prism.query;

import java.util.List;
import java.util.Objects;

/**
 * Reference to one column of one view.
 *
 * A reference read from a {@code [column, view]} array keeps the array's parsed
 * elements as children. They are walked instead when the reference names a
 * different view, so {@code ["sum", "impressions.v"]} still reaches its operand.
 * Equality ignores the children.
 */
public class ColumnRef implements ExpressionNode {
    private final String column;
    private final String view;
    private final List<ExpressionNode> elements;

    public ColumnRef(String column, String view) {
        this(column, view, List.of());
    }

    public ColumnRef(String column, String view, List<ExpressionNode> elements) {
        this.column = Objects.requireNonNull(column, "column");
        this.view = Objects.requireNonNull(view, "view");
        this.elements = List.copyOf(elements);
    }

    public String getColumn() {
        return column;
    }

    public String getView() {
        return view;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COLUMN_REF;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnRef that = (ColumnRef) o;
        return column.equals(that.column) && view.equals(that.view);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, view);
    }

    @Override
    public String toString() {
        return "[" + column + ", " + view + "]";
    }
}
