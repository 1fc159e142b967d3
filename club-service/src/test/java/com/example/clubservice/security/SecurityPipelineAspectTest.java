package com.example.clubservice.security;

import com.example.clubservice.audit.AuditRecorder;
import com.example.clubservice.entity.Role;
import com.example.clubservice.tenant.TenantAccessGuard;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.aspectj.lang.ProceedingJoinPoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Requests that never went through the tenant context interceptor.
 */
@ExtendWith(MockitoExtension.class)
class SecurityPipelineAspectTest {

    @Mock
    private TenantAccessGuard tenantAccessGuard;

    @Mock
    private AuditRecorder auditRecorder;

    @Mock
    private ProceedingJoinPoint joinPoint;

    private SecurityPipelineAspect aspect;

    @BeforeEach
    void setUp() {
        aspect = new SecurityPipelineAspect(tenantAccessGuard, auditRecorder, new ObjectMapper());
        RequestContextHolder.setRequestAttributes(
                new ServletRequestAttributes(new MockHttpServletRequest("POST", "/courses")));
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
        SecurityContextHolder.clearContext();
    }

    @Test
    void authenticatedRequestWithoutTenantContextIsDenied() throws Throwable {
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(1L, "org-1", Role.COACH, "coach@club.test");
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.authorities()));

        assertThrows(AccessDeniedException.class, () -> aspect.guardAndAudit(joinPoint));

        verify(joinPoint, never()).proceed();
        verifyNoInteractions(tenantAccessGuard, auditRecorder);
    }

    @Test
    void anonymousRequestWithoutTenantContextProceeds() throws Throwable {
        when(joinPoint.proceed()).thenReturn("ok");

        assertEquals("ok", aspect.guardAndAudit(joinPoint));

        verifyNoInteractions(tenantAccessGuard, auditRecorder);
    }
}
