package com.example.clubservice.route;

import com.example.clubservice.entity.AuditAction;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Route security table bound from {@code club.security.routes}.
 *
 * <pre>
 * club:
 *   security:
 *     routes:
 *       - method: POST
 *         path: /api/auth/login
 *         tenant-check-exempt: true
 *         audit-exempt: true
 * </pre>
 */
@Getter @Setter
@ConfigurationProperties(prefix = "club.security")
public class RouteSecurityProperties {

    private List<Route> routes = new ArrayList<>();

    @Getter @Setter
    public static class Route {

        /** HTTP method, e.g. POST. */
        private String method;

        /** Path pattern exactly as mapped by the controller, e.g. /api/audit-logs/{id}. */
        private String path;

        private boolean auditExempt = false;

        private boolean tenantCheckExempt = false;

        private AuditAction actionOverride;

        private String entityTypeOverride;
    }
}
