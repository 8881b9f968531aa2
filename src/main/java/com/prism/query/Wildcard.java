package com.prism.query;

import java.util.List;
import java.util.Objects;

/**
 * Reference to every column of a view ({@code ["*", view]}). Like {@link ColumnRef},
 * keeps the array's parsed elements as children for other views.
 */
public class Wildcard implements ExpressionNode {
    public static final String SYMBOL = "*";

    private final String view;
    private final List<ExpressionNode> elements;

    public Wildcard(String view) {
        this(view, List.of());
    }

    public Wildcard(String view, List<ExpressionNode> elements) {
        this.view = Objects.requireNonNull(view, "view");
        this.elements = List.copyOf(elements);
    }

    public String getView() {
        return view;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WILDCARD;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return view.equals(((Wildcard) o).view);
    }

    @Override
    public int hashCode() {
        return view.hashCode();
    }

    @Override
    public String toString() {
        return "[*, " + view + "]";
    }
}
