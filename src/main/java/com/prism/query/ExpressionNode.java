package com.prism.query;

import java.util.List;

/**
 * Node of a request expression tree.
 *
 * Only column references and wildcards carry meaning for planning, and only for
 * the view they name; every other node is opaque payload whose children are
 * still traversed.
 */
public interface ExpressionNode {

    NodeKind getKind();

    List<ExpressionNode> getChildren();
}
