package com.example.clubservice.tenant;

import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.entity.Role;
import com.example.clubservice.route.RouteMetadata;
import com.example.clubservice.route.RouteMetadataRegistry;
import com.example.clubservice.route.RouteSecurityProperties;
import com.example.clubservice.security.AuthenticatedPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TenantContextResolverTest {

    private TenantContextResolver resolver;

    @BeforeEach
    void setUp() {
        RouteSecurityProperties.Route logout = new RouteSecurityProperties.Route();
        logout.setMethod("POST");
        logout.setPath("/api/auth/logout");
        logout.setActionOverride(AuditAction.LOGOUT);

        RouteSecurityProperties properties = new RouteSecurityProperties();
        properties.setRoutes(List.of(logout));

        resolver = new TenantContextResolver(new RouteMetadataRegistry(properties));
    }

    @Test
    void organizationComesFromPrincipal() {
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(7L, "org-1", Role.MEMBER, "m@club.test");
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());

        TenantScopedRequest context = resolver.resolve(authentication, "post", "/api/auth/logout");

        assertEquals("org-1", context.organizationId());
        assertSame(principal, context.principal());
        assertEquals(AuditAction.LOGOUT, context.route().actionOverride());
        assertEquals("POST /api/auth/logout", context.routeKey());
    }

    @Test
    void anonymousRequestHasNoTenant() {
        AnonymousAuthenticationToken anonymous = new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

        TenantScopedRequest context = resolver.resolve(anonymous, "GET", "/api/courses");

        assertFalse(context.hasPrincipal());
        assertNull(context.organizationId());
        assertEquals(RouteMetadata.DEFAULTS, context.route());
    }

    @Test
    void missingAuthenticationHasNoTenant() {
        TenantScopedRequest context = resolver.resolve(null, "GET", null);

        assertFalse(context.hasPrincipal());
        assertNull(context.routeKey());
    }
}
