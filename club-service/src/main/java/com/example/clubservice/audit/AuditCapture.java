package com.example.clubservice.audit;

import com.example.clubservice.route.RouteMetadata;
import com.example.clubservice.security.AuthenticatedPrincipal;
import com.example.clubservice.security.ClientInfo;

import java.util.Map;

/**
 * Everything the audit trail needs to know about one handled request.
 *
 * @param principal     verified caller, null when anonymous
 * @param route         route security metadata
 * @param httpMethod    HTTP verb
 * @param requestUrl    request path, e.g. /api/courses/42
 * @param client        caller IP and user agent
 * @param pathVariables URI template variables, never null
 * @param payload       request body as a map, null when the request has none
 */
public record AuditCapture(
        AuthenticatedPrincipal principal,
        RouteMetadata route,
        String httpMethod,
        String requestUrl,
        ClientInfo client,
        Map<String, String> pathVariables,
        Map<String, Object> payload
) {
    public AuditCapture {
        route = route != null ? route : RouteMetadata.DEFAULTS;
        client = client != null ? client : ClientInfo.UNKNOWN;
        pathVariables = pathVariables != null ? pathVariables : Map.of();
    }
}
