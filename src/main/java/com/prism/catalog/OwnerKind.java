package com.prism.catalog;

/**
 * Tenant role owning a log type's rows in the remote log store.
 */
public enum OwnerKind {
    AGENCY,
    ADVERTISER
}
