package com.prism.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the structural invariants of a loaded {@link Catalog}.
 *
 * Rules, per log type:
 * - the id is lowercase letters only, so it round-trips through view identifiers
 * - every {@code dependsOn} and {@code aliasFor} target exists in the same catalog
 * - an alias target is not itself an alias
 * - every {@code joinsRequired.targetView} and {@code fastViewCandidates} entry
 *   names a registered source view
 * - every stored column (not derived, not an alias, not a time-partition column)
 *   declares a {@code storageType}
 *
 * Fast-view candidate lists out of ascending cardinality order only produce a warning.
 */
public class CatalogValidator {

    private static final Logger log = LoggerFactory.getLogger(CatalogValidator.class);

    public void validate(Catalog catalog) {
        List<String> violations = new ArrayList<>();
        for (LogTypeCatalog logType : catalog.getLogTypes()) {
            validateLogType(catalog, logType, violations);
        }
        if (!violations.isEmpty()) {
            throw new CatalogValidationException(violations);
        }
    }

    private void validateLogType(Catalog catalog, LogTypeCatalog logType, List<String> violations) {
        Map<String, ColumnSpec> columns = logType.getColumns();
        String type = logType.getId();

        if (!LogTypeCatalog.isValidId(type)) {
            violations.add(String.format("%s: log type id must match %s", type, LogTypeCatalog.ID_REGEX));
        }

        for (ColumnSpec column : columns.values()) {
            String name = column.getName();

            if (column.isAlias()) {
                ColumnSpec target = columns.get(column.getAliasFor());
                if (target == null) {
                    violations.add(String.format("%s.%s: aliasFor '%s' does not exist", type, name, column.getAliasFor()));
                } else if (target.isAlias()) {
                    violations.add(String.format("%s.%s: aliasFor '%s' is itself an alias", type, name, column.getAliasFor()));
                }
                continue;
            }

            for (String dependency : column.getDependsOn()) {
                if (!columns.containsKey(dependency)) {
                    violations.add(String.format("%s.%s: dependsOn '%s' does not exist", type, name, dependency));
                }
            }

            for (JoinSpec join : column.getJoinsRequired()) {
                if (catalog.findSourceView(join.getTargetView()).isEmpty()) {
                    violations.add(String.format("%s.%s: join target '%s' is not a registered source view",
                        type, name, join.getTargetView()));
                }
            }

            long previousCardinality = Long.MIN_VALUE;
            for (String candidate : column.getFastViewCandidates()) {
                var view = catalog.findSourceView(candidate);
                if (view.isEmpty()) {
                    violations.add(String.format("%s.%s: fast view '%s' is not a registered source view",
                        type, name, candidate));
                    continue;
                }
                if (view.get().getCardinality() < previousCardinality) {
                    log.warn("{}.{}: fast view candidates are not in ascending cardinality order", type, name);
                }
                previousCardinality = view.get().getCardinality();
            }

            if (!column.isDerived() && !LogTypeCatalog.isTimePartitionColumn(name) && column.getStorageType() == null) {
                violations.add(String.format("%s.%s: stored column declares no storageType", type, name));
            }
        }
    }
}
