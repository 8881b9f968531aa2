package com.prism.query;

import java.util.Arrays;
import java.util.List;

/**
 * Opaque payload node: operators, function calls, literals, object fields.
 * The planner never interprets the value; it only walks the children.
 */
public class RawNode implements ExpressionNode {
    private final String value;
    private final List<ExpressionNode> children;

    public RawNode(String value, List<ExpressionNode> children) {
        this.value = value;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static RawNode leaf(String value) {
        return new RawNode(value, List.of());
    }

    public static RawNode of(ExpressionNode... children) {
        return new RawNode(null, Arrays.asList(children));
    }

    /**
     * Scalar payload, null for containers
     */
    public String getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RAW;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return children.isEmpty() ? String.valueOf(value) : "Raw" + children;
    }
}
