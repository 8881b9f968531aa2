package com.prism.planner;

import com.prism.query.ExpressionNode;

import java.util.Objects;

/**
 * A request to plan one log view for one tenant.
 */
public class ViewRequest {

    private final String logType;
    private final long tenantId;
    private final ExpressionNode expressionTree;

    public ViewRequest(String logType, long tenantId, ExpressionNode expressionTree) {
        this.logType = logType;
        this.tenantId = tenantId;
        this.expressionTree = Objects.requireNonNull(expressionTree, "expressionTree");
    }

    public String getLogType() {
        return logType;
    }

    public long getTenantId() {
        return tenantId;
    }

    public ExpressionNode getExpressionTree() {
        return expressionTree;
    }

    @Override
    public String toString() {
        return "ViewRequest{logType='" + logType + "', tenantId=" + tenantId + "}";
    }
}
