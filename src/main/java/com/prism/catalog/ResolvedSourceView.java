package com.prism.catalog;

import java.util.Optional;

/**
 * A source view rendered for a tenant, ready to be placed in a FROM or JOIN clause.
 */
public class ResolvedSourceView {

    private final String viewId;
    private final String alias;
    private final String sourceExpression;
    private final String foreignConnection;

    public ResolvedSourceView(String viewId, String alias, String sourceExpression, String foreignConnection) {
        this.viewId = viewId;
        this.alias = alias;
        this.sourceExpression = sourceExpression;
        this.foreignConnection = foreignConnection;
    }

    public String getViewId() {
        return viewId;
    }

    public String getAlias() {
        return alias;
    }

    public String getSourceExpression() {
        return sourceExpression;
    }

    public Optional<String> getForeignConnection() {
        return Optional.ofNullable(foreignConnection);
    }
}
