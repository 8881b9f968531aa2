package com.prism.security;

import com.prism.catalog.AccessTier;

import java.util.Objects;

/**
 * Caller identity as supplied by the authorization layer.
 *
 * - {@code tenantScope}: tenants the caller may address
 * - {@code partnerScope}: white-label partners the caller belongs to, unrestricted when absent
 * - {@code accessTierName}: tier bucket name, mapped through {@link AccessTierMapping}
 */
public class AccessContext {

    private final TenantScope tenantScope;
    private final TenantScope partnerScope;
    private final String accessTierName;

    public AccessContext(TenantScope tenantScope, TenantScope partnerScope, String accessTierName) {
        this.tenantScope = Objects.requireNonNull(tenantScope, "tenantScope");
        this.partnerScope = partnerScope == null ? TenantScope.unrestricted() : partnerScope;
        this.accessTierName = accessTierName;
    }

    public AccessContext(TenantScope tenantScope, String accessTierName) {
        this(tenantScope, TenantScope.unrestricted(), accessTierName);
    }

    public TenantScope getTenantScope() {
        return tenantScope;
    }

    public TenantScope getPartnerScope() {
        return partnerScope;
    }

    public String getAccessTierName() {
        return accessTierName;
    }

    public AccessTier getAccessTier() {
        return AccessTierMapping.fromName(accessTierName);
    }

    @Override
    public String toString() {
        return "AccessContext{tenantScope=" + tenantScope + ", partnerScope=" + partnerScope
            + ", accessTier=" + accessTierName + "}";
    }
}
