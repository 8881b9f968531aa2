package com.prism.query;

/**
 * Variants of {@link ExpressionNode}.
 */
public enum NodeKind {
    COLUMN_REF,
    WILDCARD,
    RAW
}
