package com.example.clubservice.route;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable lookup of route metadata keyed by {@code "METHOD /path/pattern"}.
 *
 * Built once at startup from {@link RouteSecurityProperties}. Routes missing from the
 * table get {@link RouteMetadata#DEFAULTS}, so a forgotten entry is audited and
 * tenant checked rather than silently exempt.
 */
@Component
@Slf4j
public class RouteMetadataRegistry {

    private final Map<String, RouteMetadata> routes;

    public RouteMetadataRegistry(RouteSecurityProperties properties) {
        Map<String, RouteMetadata> table = new HashMap<>();
        for (RouteSecurityProperties.Route route : properties.getRoutes()) {
            if (route.getMethod() == null || route.getPath() == null) {
                throw new IllegalStateException("Route entry needs both method and path: " + route.getPath());
            }
            String key = key(route.getMethod(), route.getPath());
            RouteMetadata metadata = new RouteMetadata(
                    route.isAuditExempt(),
                    route.isTenantCheckExempt(),
                    route.getActionOverride(),
                    route.getEntityTypeOverride());
            if (table.put(key, metadata) != null) {
                throw new IllegalStateException("Duplicate route entry: " + key);
            }
        }
        this.routes = Map.copyOf(table);
        log.info("Loaded security metadata for {} route(s)", this.routes.size());
    }

    /**
     * Metadata for a method and mapped path pattern, defaults when undeclared.
     */
    public RouteMetadata lookup(String method, String pathPattern) {
        if (method == null || pathPattern == null) {
            return RouteMetadata.DEFAULTS;
        }
        return routes.getOrDefault(key(method, pathPattern), RouteMetadata.DEFAULTS);
    }

    public static String key(String method, String pathPattern) {
        return method.toUpperCase(Locale.ROOT) + " " + pathPattern;
    }
}
