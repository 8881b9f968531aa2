package com.prism.lister;

import com.prism.catalog.AccessTier;
import com.prism.catalog.ColumnSpec;
import com.prism.catalog.LogTypeCatalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Column exposure rule shared by listing and planning.
 *
 * A column is exposed when it declares no tier or its tier equals the caller's
 * tier exactly. Exposing by equality keeps, for example, an internal caller on
 * {@code revenue} and a customer on its alias {@code spend}. An exposed alias
 * reports its target's category and geo tag.
 */
public final class ColumnExposure {

    private ColumnExposure() {
    }

    /**
     * Exposed columns of a log type, sorted by name
     */
    public static List<ExposedColumn> exposedColumns(LogTypeCatalog logType, AccessTier callerTier) {
        List<ExposedColumn> exposed = new ArrayList<>();
        for (ColumnSpec column : logType.getColumns().values()) {
            if (column.getAccessTier() != null && column.getAccessTier() != callerTier) {
                continue;
            }
            ColumnSpec effective = logType.effectiveSpec(column);
            exposed.add(new ExposedColumn(column.getName(), effective.getCategory(), effective.getGeoTag()));
        }
        exposed.sort(Comparator.comparing(ExposedColumn::getName));
        return exposed;
    }

    /**
     * Exposed columns restricted to {@code names}; names that are not exposed are skipped
     */
    public static List<ExposedColumn> exposedColumns(LogTypeCatalog logType, AccessTier callerTier,
                                                     Collection<String> names) {
        Set<String> wanted = Set.copyOf(names);
        List<ExposedColumn> exposed = new ArrayList<>();
        for (ExposedColumn column : exposedColumns(logType, callerTier)) {
            if (wanted.contains(column.getName())) {
                exposed.add(column);
            }
        }
        return exposed;
    }
}
