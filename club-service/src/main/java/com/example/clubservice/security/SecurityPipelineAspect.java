package com.example.clubservice.security;

import com.example.clubservice.audit.AuditCapture;
import com.example.clubservice.audit.AuditRecorder;
import com.example.clubservice.tenant.TenantAccessGuard;
import com.example.clubservice.tenant.TenantContextResolver;
import com.example.clubservice.tenant.TenantScopedRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.HttpEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the tenant guard and the audit capture around every REST handler.
 *
 * Order per request:
 * 1. TenantAccessGuard.check over the raw body, path and query - a cross-tenant
 *    reference aborts before the handler runs
 * 2. handler
 * 3. AuditRecorder.recordSuccess / recordFailure - the handler's outcome is returned unchanged
 *
 * Method security (@PreAuthorize) is applied outside this advice, so role failures
 * never reach the guard or the audit trail. An authenticated request that arrives
 * without a tenant context is denied.
 */
@Aspect
@Component
@Slf4j
public class SecurityPipelineAspect {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final TenantAccessGuard tenantAccessGuard;
    private final AuditRecorder auditRecorder;
    private final ObjectMapper objectMapper;

    public SecurityPipelineAspect(TenantAccessGuard tenantAccessGuard,
                                  AuditRecorder auditRecorder,
                                  ObjectMapper objectMapper) {
        this.tenantAccessGuard = tenantAccessGuard;
        this.auditRecorder = auditRecorder;
        this.objectMapper = objectMapper;
    }

    @Around("@within(org.springframework.web.bind.annotation.RestController)")
    public Object guardAndAudit(ProceedingJoinPoint joinPoint) throws Throwable {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes)) {
            return joinPoint.proceed();
        }
        HttpServletRequest request = attributes.getRequest();
        if (!(request.getAttribute(TenantScopedRequest.ATTRIBUTE) instanceof TenantScopedRequest context)) {
            if (TenantContextResolver.principalOf(SecurityContextHolder.getContext().getAuthentication()) != null) {
                log.error("No tenant context for authenticated request {} {}", request.getMethod(), request.getRequestURI());
                throw new AccessDeniedException("Tenant context unavailable");
            }
            // Anonymous and outside the MVC handler chain
            return joinPoint.proceed();
        }

        Map<String, Object> body = requestBody(request, (MethodSignature) joinPoint.getSignature());
        Map<String, String> pathVariables = pathVariables(request);

        tenantAccessGuard.check(context, body, pathVariables, request.getParameterMap());

        AuditCapture capture = new AuditCapture(
                context.principal(),
                context.route(),
                request.getMethod(),
                request.getRequestURI(),
                ClientInfo.from(request),
                pathVariables,
                body);

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable ex) {
            auditRecorder.recordFailure(capture, ex);
            throw ex;
        }

        auditRecorder.recordSuccess(capture, result instanceof HttpEntity<?> entity ? entity.getBody() : result);
        return result;
    }

    /**
     * The body as sent by the client, not the bound argument: properties unknown to a
     * typed request DTO must still reach the guard.
     */
    private Map<String, Object> requestBody(HttpServletRequest request, MethodSignature signature) throws IOException {
        if (request.getAttribute(RawRequestBodyAdvice.ATTRIBUTE) instanceof byte[] raw) {
            return toMap(raw);
        }
        if (readsBody(signature.getMethod()) || !isJson(request.getContentType())) {
            return null;
        }
        // Handler ignores the body; nothing else will consume the stream
        return toMap(StreamUtils.copyToByteArray(request.getInputStream()));
    }

    private static boolean readsBody(Method method) {
        for (Parameter parameter : method.getParameters()) {
            Class<?> type = parameter.getType();
            if (parameter.isAnnotationPresent(RequestBody.class)
                    || parameter.isAnnotationPresent(RequestPart.class)
                    || HttpEntity.class.isAssignableFrom(type)
                    || ServletRequest.class.isAssignableFrom(type)
                    || InputStream.class.isAssignableFrom(type)
                    || Reader.class.isAssignableFrom(type)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isJson(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    private Map<String, Object> toMap(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, MAP_TYPE);
        } catch (IOException e) {
            log.debug("Request body is not a JSON object, no payload to scan");
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> pathVariables(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return variables instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
    }
}
