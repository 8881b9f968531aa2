package com.prism.tenant;

/**
 * Owning identity of a tenant: the agency (parent) id and the advertiser id.
 *
 * Agency tenants are their own agency and carry advertiser id 0; advertiser
 * tenants carry their own id as advertiser id and the parent agency id.
 */
public class TenantIdentity {

    private final long agencyId;
    private final long advertiserId;

    public TenantIdentity(long agencyId, long advertiserId) {
        this.agencyId = agencyId;
        this.advertiserId = advertiserId;
    }

    public static TenantIdentity agency(long agencyId) {
        return new TenantIdentity(agencyId, 0L);
    }

    public static TenantIdentity advertiser(long agencyId, long advertiserId) {
        return new TenantIdentity(agencyId, advertiserId);
    }

    public long getAgencyId() {
        return agencyId;
    }

    public long getAdvertiserId() {
        return advertiserId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TenantIdentity that = (TenantIdentity) o;
        return agencyId == that.agencyId && advertiserId == that.advertiserId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(agencyId) * 31 + Long.hashCode(advertiserId);
    }

    @Override
    public String toString() {
        return "TenantIdentity{agencyId=" + agencyId + ", advertiserId=" + advertiserId + "}";
    }
}
