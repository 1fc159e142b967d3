package com.example.clubservice.tenant;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Builds the {@link TenantScopedRequest} once per request, after authentication and
 * before the handler, and stores it as a request attribute.
 *
 * Nothing is kept in thread-local storage; the context dies with the request.
 */
@Component
@Slf4j
public class TenantContextInterceptor implements HandlerInterceptor {

    private final TenantContextResolver tenantContextResolver;

    public TenantContextInterceptor(TenantContextResolver tenantContextResolver) {
        this.tenantContextResolver = tenantContextResolver;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (request.getAttribute(TenantScopedRequest.ATTRIBUTE) != null) {
            return true;
        }

        String pattern = (String) request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        TenantScopedRequest context = tenantContextResolver.resolve(
                SecurityContextHolder.getContext().getAuthentication(),
                request.getMethod(),
                pattern);

        request.setAttribute(TenantScopedRequest.ATTRIBUTE, context);
        log.debug("Tenant context resolved for {} (organization: {})", context.routeKey(), context.organizationId());
        return true;
    }
}
