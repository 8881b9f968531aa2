package com.prism.lister;

import com.prism.catalog.AccessTier;
import com.prism.catalog.Catalog;
import com.prism.catalog.LogTypeCatalog;
import com.prism.catalog.OwnerKind;
import com.prism.error.InvalidLogTypeException;
import com.prism.security.AccessContext;
import com.prism.security.TenantAccessValidator;
import com.prism.tenant.Tenant;
import com.prism.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates and describes the views a caller can address.
 *
 * Every agency tenant visible to the caller is crossed with every log type.
 * Column metadata follows {@link ColumnExposure}.
 */
@Service
public class ViewCatalogLister {

    private static final Logger log = LoggerFactory.getLogger(ViewCatalogLister.class);

    private final Catalog catalog;
    private final TenantDirectory tenantDirectory;
    private final TenantAccessValidator accessValidator;

    public ViewCatalogLister(Catalog catalog, TenantDirectory tenantDirectory, TenantAccessValidator accessValidator) {
        this.catalog = catalog;
        this.tenantDirectory = tenantDirectory;
        this.accessValidator = accessValidator;
    }

    public Mono<List<ViewDescriptor>> listViews(AccessContext context, ListViewsOptions options) {
        AccessTier tier = context.getAccessTier();
        return tenantDirectory.getTenants(context.getPartnerScope(), context.getTenantScope(), OwnerKind.AGENCY)
            .map(tenants -> {
                List<ViewDescriptor> views = new ArrayList<>();
                for (Tenant tenant : tenants) {
                    for (LogTypeCatalog logType : catalog.getLogTypes()) {
                        if (!options.matchesCategory(logType.getCategory())) {
                            continue;
                        }
                        views.add(describe(logType, tenant,
                            options.isIncludeColumns() ? ColumnExposure.exposedColumns(logType, tier) : null));
                    }
                }
                log.debug("Listed {} views over {} tenants", views.size(), tenants.size());
                return views;
            });
    }

    public Mono<ViewDescriptor> getView(AccessContext context, String viewId) {
        return Mono.fromCallable(() -> ViewIdentifier.parse(viewId))
            .flatMap(id -> {
                LogTypeCatalog logType = catalog.findLogType(id.getLogType())
                    .orElseThrow(() -> new InvalidLogTypeException(id.getLogType()));
                return accessValidator.requireTenant(context, id.getTenantId(), OwnerKind.AGENCY)
                    .map(tenant -> describe(logType, tenant,
                        ColumnExposure.exposedColumns(logType, context.getAccessTier())));
            });
    }

    static ViewDescriptor describe(LogTypeCatalog logType, Tenant tenant, List<ExposedColumn> columns) {
        String label = String.format("%s - %s (%d)", logType.getDisplayName(), tenant.getName(), tenant.getId());
        return new ViewDescriptor(label,
            new ViewDescriptor.ViewReference(logType.getId(), logType.getCategory(), tenant.getId()),
            columns);
    }
}
