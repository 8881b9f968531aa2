package com.prism.catalog;

public enum JoinKind {

    LEFT("LEFT JOIN"),
    INNER("INNER JOIN");

    private final String keyword;

    JoinKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
