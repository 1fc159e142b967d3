package com.example.clubservice.tenant;

import com.example.clubservice.route.RouteMetadata;
import com.example.clubservice.security.AuthenticatedPrincipal;

/**
 * Tenant context of one request, built once from the verified principal.
 *
 * Travels as a request attribute and is injected into controllers as a method
 * argument. {@code principal} and {@code organizationId} are null for anonymous requests.
 *
 * @param organizationId the caller's organization, taken from the principal only
 * @param principal      verified caller, null when anonymous
 * @param route          security metadata of the matched route
 * @param routeKey       route identifier, {@code "METHOD /path/pattern"}
 */
public record TenantScopedRequest(
        String organizationId,
        AuthenticatedPrincipal principal,
        RouteMetadata route,
        String routeKey
) {
    public static final String ATTRIBUTE = TenantScopedRequest.class.getName();

    public boolean hasPrincipal() {
        return principal != null;
    }
}
