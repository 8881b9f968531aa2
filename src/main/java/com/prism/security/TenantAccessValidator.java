package com.prism.security;

import com.prism.catalog.OwnerKind;
import com.prism.error.ViewAccessDeniedException;
import com.prism.tenant.Tenant;
import com.prism.tenant.TenantDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Tenant access validation for view planning and listing.
 *
 * Access to a tenant requires both:
 * 1. the tenant id is within the caller's tenant scope (or the scope is unrestricted)
 * 2. the tenant directory resolves a matching tenant within the caller's partner scope
 *
 * Either failure raises {@link ViewAccessDeniedException}, logged at warn for
 * security monitoring.
 *
 * @see AccessContext
 * @see TenantDirectory
 */
@Component
public class TenantAccessValidator {

    private static final Logger log = LoggerFactory.getLogger(TenantAccessValidator.class);

    private final TenantDirectory tenantDirectory;

    public TenantAccessValidator(TenantDirectory tenantDirectory) {
        this.tenantDirectory = tenantDirectory;
    }

    /**
     * Validates that the tenant is within the caller's tenant scope.
     *
     * @param context caller access context
     * @param tenantId requested tenant
     * @throws ViewAccessDeniedException if the tenant is out of scope
     */
    public void validateTenantAccess(AccessContext context, long tenantId) {
        if (tenantId <= 0 || !context.getTenantScope().contains(tenantId)) {
            log.warn("Tenant access denied: tenant {} is outside scope {}", tenantId, context.getTenantScope());
            throw new ViewAccessDeniedException(tenantId, "Invalid access permissions");
        }
        log.debug("Tenant validation successful for tenant {}", tenantId);
    }

    /**
     * Validates scope, then resolves the first directory entry of the given kind
     * for the tenant.
     *
     * For {@link OwnerKind#AGENCY} this is the agency itself; for
     * {@link OwnerKind#ADVERTISER} it is the agency's advertiser.
     *
     * @return the resolved tenant, or a {@link ViewAccessDeniedException} error when
     * the directory has no entry
     */
    public Mono<Tenant> requireTenant(AccessContext context, long tenantId, OwnerKind kind) {
        return Mono.fromRunnable(() -> validateTenantAccess(context, tenantId))
            .then(Mono.defer(() -> tenantDirectory.getTenants(context.getPartnerScope(), TenantScope.of(tenantId), kind)))
            .flatMap(tenants -> {
                if (tenants.isEmpty()) {
                    log.warn("Tenant access denied: no {} entry for tenant {} in partner scope {}",
                        kind, tenantId, context.getPartnerScope());
                    return Mono.error(new ViewAccessDeniedException(tenantId, "Invalid access permissions"));
                }
                return Mono.just(tenants.get(0));
            });
    }
}
