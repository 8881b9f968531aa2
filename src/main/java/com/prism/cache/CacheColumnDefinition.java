package com.prism.cache;

/**
 * Physical column of a cache table
 */
public class CacheColumnDefinition {
    private final String name;
    private final String storageType;

    public CacheColumnDefinition(String name, String storageType) {
        this.name = name;
        this.storageType = storageType;
    }

    public String getName() {
        return name;
    }

    public String getStorageType() {
        return storageType;
    }

    public String toSql() {
        return "\"" + name + "\" " + storageType;
    }

    @Override
    public String toString() {
        return toSql();
    }
}
