package com.example.clubservice.tenant;

import com.example.clubservice.route.RouteMetadata;
import com.example.clubservice.route.RouteMetadataRegistry;
import com.example.clubservice.security.AuthenticatedPrincipal;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Derives the caller's tenant from the verified principal and pairs it with the
 * route's security metadata.
 *
 * Request body, path and query never contribute to the resolved organization.
 */
@Component
public class TenantContextResolver {

    private final RouteMetadataRegistry routeMetadataRegistry;

    public TenantContextResolver(RouteMetadataRegistry routeMetadataRegistry) {
        this.routeMetadataRegistry = routeMetadataRegistry;
    }

    /**
     * @param authentication current authentication, may be null or anonymous
     * @param method         HTTP method
     * @param pathPattern    best matching handler pattern, e.g. /api/courses/{id}
     */
    public TenantScopedRequest resolve(Authentication authentication, String method, String pathPattern) {
        AuthenticatedPrincipal principal = principalOf(authentication);
        RouteMetadata route = routeMetadataRegistry.lookup(method, pathPattern);
        String routeKey = pathPattern != null ? RouteMetadataRegistry.key(method, pathPattern) : null;
        return new TenantScopedRequest(
                principal != null ? principal.organizationId() : null,
                principal,
                route,
                routeKey);
    }

    public static AuthenticatedPrincipal principalOf(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            return null;
        }
        if (authentication.getPrincipal() instanceof AuthenticatedPrincipal principal) {
            return principal;
        }
        return null;
    }
}
