package com.prism.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of log type catalogs and source views.
 *
 * Built once at startup from configuration and injected wherever a component
 * needs catalog data; nothing mutates it afterwards.
 */
public class Catalog {

    private final Map<String, LogTypeCatalog> logTypes;
    private final Map<String, SourceViewDefinition> sourceViews;

    public Catalog(Collection<LogTypeCatalog> logTypes, Collection<SourceViewDefinition> sourceViews) {
        Map<String, LogTypeCatalog> types = new LinkedHashMap<>();
        for (LogTypeCatalog logType : logTypes) {
            if (types.put(logType.getId(), logType) != null) {
                throw new IllegalArgumentException("Duplicate log type: " + logType.getId());
            }
        }
        Map<String, SourceViewDefinition> views = new LinkedHashMap<>();
        for (SourceViewDefinition view : sourceViews) {
            if (views.put(view.getId(), view) != null) {
                throw new IllegalArgumentException("Duplicate source view: " + view.getId());
            }
        }
        this.logTypes = Collections.unmodifiableMap(types);
        this.sourceViews = Collections.unmodifiableMap(views);
    }

    public Optional<LogTypeCatalog> findLogType(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(logTypes.get(id));
    }

    public Collection<LogTypeCatalog> getLogTypes() {
        return logTypes.values();
    }

    public Optional<SourceViewDefinition> findSourceView(String id) {
        return Optional.ofNullable(sourceViews.get(id));
    }

    /**
     * Look up a source view the catalog references; a miss means the catalog is inconsistent
     */
    public SourceViewDefinition requireSourceView(String id) {
        SourceViewDefinition view = sourceViews.get(id);
        if (view == null) {
            throw new IllegalStateException("Source view not registered: " + id);
        }
        return view;
    }

    public Collection<SourceViewDefinition> getSourceViews() {
        return sourceViews.values();
    }
}
