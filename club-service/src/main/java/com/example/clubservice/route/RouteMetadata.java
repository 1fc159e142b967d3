package com.example.clubservice.route;

import com.example.clubservice.entity.AuditAction;

/**
 * Security metadata declared for one route.
 *
 * @param auditExempt        no audit entry is written for the route
 * @param tenantCheckExempt  the tenant guard is skipped for the route
 * @param actionOverride     audit action replacing the one derived from the HTTP verb, may be null
 * @param entityTypeOverride audit entity type replacing the one derived from the path, may be null
 */
public record RouteMetadata(
        boolean auditExempt,
        boolean tenantCheckExempt,
        AuditAction actionOverride,
        String entityTypeOverride
) {
    /**
     * Metadata of an undeclared route: audited and tenant checked.
     */
    public static final RouteMetadata DEFAULTS = new RouteMetadata(false, false, null, null);
}
