package com.example.clubservice.route;

import com.example.clubservice.entity.AuditAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteMetadataRegistryTest {

    private static RouteSecurityProperties.Route route(String method, String path) {
        RouteSecurityProperties.Route route = new RouteSecurityProperties.Route();
        route.setMethod(method);
        route.setPath(path);
        return route;
    }

    private static RouteMetadataRegistry registry(RouteSecurityProperties.Route... routes) {
        RouteSecurityProperties properties = new RouteSecurityProperties();
        properties.setRoutes(List.of(routes));
        return new RouteMetadataRegistry(properties);
    }

    @Test
    void returnsDeclaredMetadata() {
        RouteSecurityProperties.Route renew = route("POST", "/api/subscriptions/{id}/renew");
        renew.setActionOverride(AuditAction.RENEW);
        renew.setEntityTypeOverride("Subscription");

        RouteMetadata metadata = registry(renew).lookup("POST", "/api/subscriptions/{id}/renew");

        assertEquals(AuditAction.RENEW, metadata.actionOverride());
        assertEquals("Subscription", metadata.entityTypeOverride());
        assertFalse(metadata.auditExempt());
        assertFalse(metadata.tenantCheckExempt());
    }

    @Test
    void methodIsCaseInsensitive() {
        RouteSecurityProperties.Route login = route("post", "/api/auth/login");
        login.setAuditExempt(true);

        assertTrue(registry(login).lookup("POST", "/api/auth/login").auditExempt());
    }

    @Test
    void undeclaredRouteFailsClosed() {
        RouteMetadata metadata = registry().lookup("DELETE", "/api/courses/{id}");

        assertSame(RouteMetadata.DEFAULTS, metadata);
        assertFalse(metadata.auditExempt());
        assertFalse(metadata.tenantCheckExempt());
    }

    @Test
    void differentMethodIsDifferentRoute() {
        RouteSecurityProperties.Route read = route("GET", "/api/audit-logs");
        read.setAuditExempt(true);

        assertFalse(registry(read).lookup("POST", "/api/audit-logs").auditExempt());
    }

    @Test
    void rejectsDuplicateEntries() {
        assertThrows(IllegalStateException.class,
                () -> registry(route("GET", "/api/courses"), route("get", "/api/courses")));
    }

    @Test
    void rejectsIncompleteEntries() {
        assertThrows(IllegalStateException.class, () -> registry(route(null, "/api/courses")));
    }
}
