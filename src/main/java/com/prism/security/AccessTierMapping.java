package com.prism.security;

import com.prism.catalog.AccessTier;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed table from the authorization layer's access tier names to {@link AccessTier}.
 * Unknown or missing names map to {@link AccessTier#PUBLIC}.
 */
public final class AccessTierMapping {

    private static final Map<String, AccessTier> TIERS = Map.of(
        "dev", AccessTier.INTERNAL,
        "internal", AccessTier.INTERNAL,
        "wl", AccessTier.CUSTOMER,
        "customers", AccessTier.CUSTOMER
    );

    private AccessTierMapping() {
    }

    public static AccessTier fromName(String name) {
        if (name == null) {
            return AccessTier.PUBLIC;
        }
        return TIERS.getOrDefault(name.trim().toLowerCase(Locale.ROOT), AccessTier.PUBLIC);
    }
}
