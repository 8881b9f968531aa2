package com.prism.planner;

import com.prism.cache.CacheRegistration;
import com.prism.cache.ViewCacheRegistry;
import com.prism.catalog.AccessTier;
import com.prism.catalog.Catalog;
import com.prism.catalog.ColumnSpec;
import com.prism.catalog.JoinSpec;
import com.prism.catalog.LogTypeCatalog;
import com.prism.catalog.OwnerKind;
import com.prism.catalog.ResolvedSourceView;
import com.prism.connection.ForeignConnectionInitializer;
import com.prism.error.ColumnCountOutOfBoundsException;
import com.prism.error.InvalidLogTypeException;
import com.prism.error.UnknownColumnException;
import com.prism.error.ViewPlanningException;
import com.prism.extraction.ExtractionQueryCompiler;
import com.prism.fastview.FastViewSelector;
import com.prism.lister.ColumnExposure;
import com.prism.lister.ViewIdentifier;
import com.prism.query.ColumnDependencyResolver;
import com.prism.query.ColumnResolution;
import com.prism.security.AccessContext;
import com.prism.security.TenantAccessValidator;
import com.prism.tenant.TenantDirectory;
import com.prism.tenant.TenantIdentity;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans a log view request end to end.
 *
 * Steps:
 * 1. check the log type exists
 * 2. check tenant scope and resolve the tenant's advertiser through the directory
 * 3. resolve the requested columns against the catalog at the caller's tier
 * 4. bound the cache column count and check every cache column is known
 * 5. read from the lowest-cardinality fast view holding every cache column, or
 *    else from the tenant's cache table for the column set (created on first use,
 *    with its extraction query)
 * 6. project each requested column through its presentation expression, joining
 *    each referenced dimension view once
 * 7. initialize the distinct foreign connections concurrently
 *
 * Any failure fails the whole plan; no partial plan is returned.
 */
@Service
public class FederatedViewPlanner {

    private static final Logger log = LoggerFactory.getLogger(FederatedViewPlanner.class);

    static final String DEFAULT_TIME_ZONE = "UTC";

    private final Catalog catalog;
    private final TenantAccessValidator accessValidator;
    private final TenantDirectory tenantDirectory;
    private final ColumnDependencyResolver resolver;
    private final FastViewSelector fastViewSelector;
    private final ViewCacheRegistry cacheRegistry;
    private final ExtractionQueryCompiler extractionCompiler;
    private final ForeignConnectionInitializer connectionInitializer;
    private final PlannerMetrics metrics;

    @Value("${prism.planner.max-view-columns:10}")
    private int maxViewColumns = 10;

    @Value("${prism.storage.cache.schema:ql}")
    private String cacheSchema = "ql";

    public FederatedViewPlanner(Catalog catalog,
                                TenantAccessValidator accessValidator,
                                TenantDirectory tenantDirectory,
                                ColumnDependencyResolver resolver,
                                FastViewSelector fastViewSelector,
                                ViewCacheRegistry cacheRegistry,
                                ExtractionQueryCompiler extractionCompiler,
                                ForeignConnectionInitializer connectionInitializer,
                                PlannerMetrics metrics) {
        this.catalog = catalog;
        this.accessValidator = accessValidator;
        this.tenantDirectory = tenantDirectory;
        this.resolver = resolver;
        this.fastViewSelector = fastViewSelector;
        this.cacheRegistry = cacheRegistry;
        this.extractionCompiler = extractionCompiler;
        this.connectionInitializer = connectionInitializer;
        this.metrics = metrics;
    }

    public Mono<ViewPlan> planView(AccessContext context, ViewRequest request) {
        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startPlan();
            long tenantId = request.getTenantId();
            return Mono.fromCallable(() -> catalog.findLogType(request.getLogType())
                    .orElseThrow(() -> new InvalidLogTypeException(request.getLogType())))
                .flatMap(logType -> accessValidator.requireTenant(context, tenantId, OwnerKind.ADVERTISER)
                    .map(advertiser -> TenantIdentity.advertiser(tenantId, advertiser.getId()))
                    .flatMap(identity -> plan(context, request, logType, identity)))
                .doOnSuccess(plan -> {
                    metrics.recordPlanProduced(plan.getSource());
                    log.info("Planned view {} from {} ({} columns, connections={})", plan.getViewId(),
                        plan.getSource(), plan.getExposedColumns().size(), plan.getForeignConnections());
                })
                .doOnError(error -> {
                    if (error instanceof ViewPlanningException) {
                        metrics.recordPlanRejected(((ViewPlanningException) error).getErrorCode());
                        log.warn("Rejected view request {}: {}", request, error.getMessage());
                    } else {
                        metrics.recordPlanFailed();
                        log.error("Failed to plan view request {}", request, error);
                    }
                })
                .doFinally(signal -> metrics.stopPlan(sample));
        });
    }

    private Mono<ViewPlan> plan(AccessContext context, ViewRequest request,
                                LogTypeCatalog logType, TenantIdentity identity) {
        long tenantId = identity.getAgencyId();
        String viewId = ViewIdentifier.format(logType.getId(), tenantId);
        AccessTier callerTier = context.getAccessTier();

        ColumnResolution resolution = resolver.resolve(viewId, logType.getColumns(),
            request.getExpressionTree(), callerTier);
        Set<String> cacheColumns = resolution.getCacheColumns();

        if (cacheColumns.isEmpty() || cacheColumns.size() > maxViewColumns) {
            throw new ColumnCountOutOfBoundsException(logType.getId(), cacheColumns.size(), maxViewColumns);
        }
        for (String column : cacheColumns) {
            if (!logType.hasColumn(column)) {
                throw new UnknownColumnException(logType.getId(), column);
            }
        }

        List<String> fastViews = fastViewSelector.selectFastViews(logType.getColumns(), cacheColumns);

        Mono<PlannedSource> source;
        if (!fastViews.isEmpty()) {
            ResolvedSourceView fastView = catalog.requireSourceView(fastViews.get(0)).instantiate(identity);
            log.debug("View {} served by fast view {}", viewId, fastView.getViewId());
            source = Mono.just(new PlannedSource(
                PlanSource.fastView(fastView.getViewId()),
                ViewQueryAssembler.fastViewSource(fastView),
                null,
                fastView.getForeignConnection().orElse(null)));
        } else {
            source = cacheRegistry.lookupOrCreate(logType, tenantId, cacheColumns,
                    () -> extractionCompiler.compileExtraction(identity, logType, cacheColumns))
                .doOnNext(this::recordRegistration)
                .flatMap(registration -> tenantDirectory.getTenantTimeZone(tenantId)
                    .defaultIfEmpty(DEFAULT_TIME_ZONE)
                    .map(timeZone -> new PlannedSource(
                        PlanSource.cache(registration.getCacheId()),
                        ViewQueryAssembler.cacheSource(cacheSchema, registration.getCacheId()),
                        timeZone,
                        null)));
        }

        return source.flatMap(planned -> {
            ViewPlan plan = assemble(viewId, logType, identity, resolution, planned, callerTier);
            return Flux.fromIterable(plan.getForeignConnections())
                .flatMap(connectionId -> connectionInitializer.initialize(connectionId)
                    .doOnSuccess(ignored -> metrics.recordForeignConnectionInitialized()))
                .then(Mono.just(plan));
        });
    }

    private ViewPlan assemble(String viewId, LogTypeCatalog logType, TenantIdentity identity,
                              ColumnResolution resolution, PlannedSource planned, AccessTier callerTier) {
        ViewQueryAssembler assembler = new ViewQueryAssembler();
        if (planned.timeZone != null) {
            assembler.from(planned.sourceSql, planned.timeZone);
        } else {
            assembler.from(planned.sourceSql);
        }

        Map<String, JoinSpec> joins = new LinkedHashMap<>();
        for (String name : resolution.getQueryColumns()) {
            ColumnSpec column = logType.findColumn(name)
                .orElseThrow(() -> new UnknownColumnException(logType.getId(), name));
            ColumnSpec effective = logType.effectiveSpec(column);
            String stored = ViewQueryAssembler.SOURCE_ALIAS + ".\"" + logType.storedName(column) + "\"";
            String expression = effective.getPresentationExpression();

            for (JoinSpec join : effective.getJoinsRequired()) {
                joins.putIfAbsent(join.getTargetView(), join);
            }
            if (effective.isAggregate()) {
                assembler.aggregate((expression != null ? expression.trim() : "SUM(" + stored + ")") + " AS \"" + name + "\"");
            } else {
                assembler.groupBy((expression != null ? expression.trim() : stored) + " AS \"" + name + "\"");
            }
        }

        Set<String> connections = new LinkedHashSet<>();
        if (planned.foreignConnection != null) {
            connections.add(planned.foreignConnection);
        }
        for (JoinSpec join : joins.values()) {
            ResolvedSourceView target = catalog.requireSourceView(join.getTargetView()).instantiate(identity);
            assembler.join(JoinEmitter.emit(join, target));
            target.getForeignConnection().ifPresent(connections::add);
        }

        List<Long> cacheDependencies = planned.source.getKind() == PlanSource.Kind.CACHE
            ? List.of(Long.parseLong(planned.source.getId()))
            : List.of();

        return new ViewPlan(
            viewId,
            assembler.build(),
            ColumnExposure.exposedColumns(logType, callerTier, resolution.getQueryColumns()),
            cacheDependencies,
            resolution.getMinAccessTier().getLevel() >= AccessTier.INTERNAL.getLevel(),
            List.copyOf(connections),
            planned.source);
    }

    private void recordRegistration(CacheRegistration registration) {
        if (registration.isCreated()) {
            metrics.recordCacheTableCreated();
        }
        if (registration.getAttempts() > 1) {
            metrics.recordCacheRegistryConflicts(registration.getAttempts() - 1);
        }
    }

    void setMaxViewColumns(int maxViewColumns) {
        this.maxViewColumns = maxViewColumns;
    }

    private static final class PlannedSource {
        private final PlanSource source;
        private final String sourceSql;
        private final String timeZone;
        private final String foreignConnection;

        private PlannedSource(PlanSource source, String sourceSql, String timeZone, String foreignConnection) {
            this.source = source;
            this.sourceSql = sourceSql;
            this.timeZone = timeZone;
            this.foreignConnection = foreignConnection;
        }
    }
}
