package com.prism.tenant;

import com.prism.catalog.OwnerKind;
import com.prism.security.TenantScope;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Lookup port for tenants and their settings.
 */
public interface TenantDirectory {

    /**
     * Active tenants of one kind.
     *
     * @param partnerScope white-label partners to restrict to
     * @param idFilter for AGENCY, the tenant ids; for ADVERTISER, the parent agency ids
     * @param kind which tenant role to return
     */
    Mono<List<Tenant>> getTenants(TenantScope partnerScope, TenantScope idFilter, OwnerKind kind);

    /**
     * IANA time zone configured for a tenant; empty when none is configured
     */
    Mono<String> getTenantTimeZone(long tenantId);
}
