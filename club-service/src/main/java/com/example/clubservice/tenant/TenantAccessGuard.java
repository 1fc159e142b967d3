package com.example.clubservice.tenant;

import com.example.clubservice.exception.TenantMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Rejects requests that reference an organization other than the caller's.
 *
 * Locations are scanned in the order body, path, query. Within each location the keys
 * organization_id, organizationId, organization.id and orgId are checked in that order.
 * The first mismatch aborts the request with {@link TenantMismatchException}.
 *
 * Read-only and synchronous: no I/O and the inputs are never modified.
 */
@Component
@Slf4j
public class TenantAccessGuard {

    static final String LOCATION_BODY = "body";
    static final String LOCATION_PATH = "path";
    static final String LOCATION_QUERY = "query";

    static final String NESTED_KEY = "organization.id";
    static final List<String> SCOPING_KEYS = List.of("organization_id", "organizationId", NESTED_KEY, "orgId");

    /**
     * @param context         tenant context of the request
     * @param body            request body as a map, may be null
     * @param pathVariables   URI template variables, may be null
     * @param queryParameters query string parameters, may be null
     * @throws TenantMismatchException on the first cross-tenant reference
     */
    public void check(TenantScopedRequest context,
                      Map<String, ?> body,
                      Map<String, String> pathVariables,
                      Map<String, String[]> queryParameters) {
        if (context == null || !context.hasPrincipal()) {
            // Authentication layer decides about anonymous requests
            return;
        }
        if (context.route().tenantCheckExempt()) {
            return;
        }

        String organizationId = context.organizationId();

        if (body != null) {
            for (String key : SCOPING_KEYS) {
                verify(organizationId, bodyValue(body, key), LOCATION_BODY, key, context);
            }
        }
        if (pathVariables != null) {
            for (String key : SCOPING_KEYS) {
                verify(organizationId, pathVariables.get(key), LOCATION_PATH, key, context);
            }
        }
        if (queryParameters != null) {
            for (String key : SCOPING_KEYS) {
                String[] values = queryParameters.get(key);
                if (values == null) {
                    continue;
                }
                for (String value : values) {
                    verify(organizationId, value, LOCATION_QUERY, key, context);
                }
            }
        }
    }

    private static Object bodyValue(Map<String, ?> body, String key) {
        if (NESTED_KEY.equals(key)) {
            Object organization = body.get("organization");
            if (organization instanceof Map<?, ?> nested) {
                return nested.get("id");
            }
            return null;
        }
        return body.get(key);
    }

    private void verify(String organizationId, Object value, String location, String key,
                        TenantScopedRequest context) {
        if (value == null) {
            return;
        }
        String candidate = String.valueOf(value);
        if (candidate.isBlank()) {
            return;
        }
        if (!candidate.equals(organizationId)) {
            log.warn("Tenant mismatch on {} for member {}: {}.{}",
                    context.routeKey(), context.principal().id(), location, key);
            throw new TenantMismatchException(location, key);
        }
    }
}
