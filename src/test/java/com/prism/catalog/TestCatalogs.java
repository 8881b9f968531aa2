package com.prism.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog fixtures shared by the test suite
 */
public final class TestCatalogs {

    public static final String CATALOG_RESOURCE = "catalog/log-types.json";

    private static Catalog shipped;

    private TestCatalogs() {
    }

    /**
     * The catalog shipped with the application (impressions and beacons)
     */
    public static synchronized Catalog shipped() {
        if (shipped == null) {
            shipped = new CatalogLoader(new ObjectMapper()).load(new ClassPathResource(CATALOG_RESOURCE));
        }
        return shipped;
    }

    public static LogTypeCatalog impressions() {
        return shipped().findLogType("imp").orElseThrow();
    }

    public static LogTypeCatalog beacons() {
        return shipped().findLogType("bcn").orElseThrow();
    }

    public static LogTypeCatalog logType(String id, OwnerKind ownerKind, ColumnSpec... columns) {
        Map<String, ColumnSpec> byName = new LinkedHashMap<>();
        for (ColumnSpec column : columns) {
            byName.put(column.getName(), column);
        }
        return new LogTypeCatalog(id, id.toUpperCase(), "test", "raw." + id + "_logs", ownerKind, byName);
    }

    public static ColumnSpec stored(String name, String storageType) {
        return ColumnSpec.builder(name)
            .category(ColumnCategory.NUMERIC)
            .storageType(storageType)
            .build();
    }

    public static ColumnSpec derived(String name, String... dependsOn) {
        return ColumnSpec.builder(name)
            .category(ColumnCategory.STRING)
            .dependsOn(List.of(dependsOn))
            .build();
    }

    public static SourceViewDefinition view(String id, long cardinality) {
        return new SourceViewDefinition(id, id.toLowerCase(), cardinality,
            "SELECT * FROM dim." + id.toLowerCase(), null);
    }
}
