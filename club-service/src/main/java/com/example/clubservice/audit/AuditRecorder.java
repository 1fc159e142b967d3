package com.example.clubservice.audit;

import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.entity.AuditLog;
import com.example.clubservice.entity.Member;
import com.example.clubservice.security.AuthenticatedPrincipal;
import com.example.clubservice.security.ClientInfo;
import com.example.clubservice.security.CorrelationIdFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one audit entry per handled request, plus the credential security events.
 *
 * Design Decisions:
 * 1. Synchronous: the entry is written before the response leaves
 * 2. REQUIRES_NEW (in AuditLogStore): entries survive a rolled back business transaction
 * 3. Graceful degradation: a failed write is logged at ERROR and never reaches the caller
 * 4. Redaction: payloads pass through PayloadRedactor before serialization
 * 5. organization_id is always the actor's, whatever the payload says
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    static final String UNKNOWN_ENTITY_TYPE = "Unknown";
    static final String MEMBER_ENTITY_TYPE = "Member";
    static final String FAILURE_PREFIX = "Failed: ";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final AuditLogStore auditLogStore;
    private final ObjectMapper objectMapper;

    public AuditRecorder(AuditLogStore auditLogStore, ObjectMapper objectMapper) {
        this.auditLogStore = auditLogStore;
        this.objectMapper = objectMapper;
    }

    // ==================== Request Audit ====================

    /**
     * Record a handler that returned normally.
     *
     * @param capture request data
     * @param result  handler result (ResponseEntity already unwrapped), may be null
     */
    public void recordSuccess(AuditCapture capture, Object result) {
        if (!shouldRecord(capture)) {
            return;
        }
        Map<String, Object> resultMap = toMap(result);
        Map<String, Object> newValues = capture.payload() != null
                ? PayloadRedactor.redact(capture.payload())
                : PayloadRedactor.redact(resultMap);

        String entityId = capture.pathVariables().get("id");
        if (entityId == null && resultMap != null && resultMap.get("id") != null) {
            entityId = String.valueOf(resultMap.get("id"));
        }

        persist(requestEntry(capture, entityId, newValues, false).success());
    }

    /**
     * Record a handler that threw. The caller rethrows the original exception.
     */
    public void recordFailure(AuditCapture capture, Throwable error) {
        if (!shouldRecord(capture)) {
            return;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();

        persist(requestEntry(capture, null, PayloadRedactor.redact(capture.payload()), true).failure(message));
    }

    // ==================== Security Events ====================

    /**
     * Successful login of an active member.
     */
    public void recordLogin(Member member, ClientInfo client) {
        persist(memberEntry(member, AuditAction.LOGIN, client)
                .description(member.getEmail() + " " + AuditAction.LOGIN.pastTense())
                .success());
    }

    /**
     * Rejected login of a known member (wrong password or account not active).
     */
    public void recordFailedLogin(Member member, ClientInfo client, String reason) {
        persist(memberEntry(member, AuditAction.FAILED_LOGIN, client)
                .description(FAILURE_PREFIX + member.getEmail() + " " + AuditAction.FAILED_LOGIN.pastTense())
                .failure(reason));
    }

    /**
     * Self registration; the new member is both actor and target.
     */
    public void recordMemberCreated(Member member, ClientInfo client) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("id", member.getId());
        snapshot.put("organization_id", member.getOrganizationId());
        snapshot.put("email", member.getEmail());
        snapshot.put("first_name", member.getFirstName());
        snapshot.put("last_name", member.getLastName());
        snapshot.put("role", member.getRole());
        snapshot.put("status", member.getStatus());

        persist(memberEntry(member, AuditAction.CREATE, client)
                .newValues(toJson(PayloadRedactor.redact(snapshot)))
                .description(describe(member.getEmail(), AuditAction.CREATE, MEMBER_ENTITY_TYPE))
                .success());
    }

    // ==================== Derivation ====================

    /**
     * Entity type from the first path segment after "api": capitalized, trailing character dropped.
     * {@code /api/courses/1} gives {@code Course}.
     */
    static String entityTypeFromPath(String path) {
        if (path == null) {
            return UNKNOWN_ENTITY_TYPE;
        }
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || "api".equals(segment)) {
                continue;
            }
            String head = segment.substring(0, 1).toUpperCase();
            String tail = segment.length() > 1 ? segment.substring(1, segment.length() - 1) : "";
            return head + tail;
        }
        return UNKNOWN_ENTITY_TYPE;
    }

    static String describe(String email, AuditAction action, String entityType) {
        return email + " " + action.pastTense() + " " + entityType;
    }

    // ==================== Internal ====================

    private boolean shouldRecord(AuditCapture capture) {
        if (capture.route().auditExempt()) {
            return false;
        }
        return capture.principal() != null;
    }

    private AuditLog.Builder requestEntry(AuditCapture capture, String entityId, Map<String, Object> newValues,
                                          boolean failed) {
        AuthenticatedPrincipal principal = capture.principal();
        AuditAction action = capture.route().actionOverride() != null
                ? capture.route().actionOverride()
                : AuditAction.fromHttpMethod(capture.httpMethod());
        String entityType = capture.route().entityTypeOverride() != null
                ? capture.route().entityTypeOverride()
                : entityTypeFromPath(capture.requestUrl());

        return AuditLog.builder()
                .organizationId(principal.organizationId())
                .actor(principal.id(), principal.email(), principal.role())
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .newValues(toJson(newValues))
                .httpMethod(capture.httpMethod())
                .requestUrl(capture.requestUrl())
                .ipAddress(capture.client().ipAddress())
                .userAgent(capture.client().userAgent())
                .description((failed ? FAILURE_PREFIX : "") + describe(principal.email(), action, entityType))
                .metadata(metadataJson());
    }

    private AuditLog.Builder memberEntry(Member member, AuditAction action, ClientInfo client) {
        ClientInfo info = client != null ? client : ClientInfo.UNKNOWN;
        return AuditLog.builder()
                .organizationId(member.getOrganizationId())
                .actor(member.getId(), member.getEmail(), member.getRole())
                .action(action)
                .entityType(MEMBER_ENTITY_TYPE)
                .entityId(member.getId() != null ? String.valueOf(member.getId()) : null)
                .httpMethod("POST")
                .ipAddress(info.ipAddress())
                .userAgent(info.userAgent())
                .metadata(metadataJson());
    }

    private void persist(AuditLog.Builder builder) {
        AuditLog entry = null;
        try {
            entry = builder.build();
            auditLogStore.append(entry);
        } catch (RuntimeException e) {
            // Graceful degradation: the audited operation keeps its outcome
            log.error("Failed to create audit log: {} on {}:{}",
                    entry != null ? entry.getAction() : null,
                    entry != null ? entry.getEntityType() : null,
                    entry != null ? entry.getEntityId() : null, e);
        }
    }

    private String metadataJson() {
        String requestId = MDC.get(CorrelationIdFilter.MDC_KEY);
        if (requestId == null) {
            return null;
        }
        return toJson(Map.of("request_id", requestId));
    }

    private Map<String, Object> toMap(Object value) {
        if (value == null || value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Collection<?> || value.getClass().isArray()) {
            return null;
        }
        try {
            return objectMapper.convertValue(value, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            log.debug("Result of type {} is not an object, no audit snapshot", value.getClass().getSimpleName());
            return null;
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit values to JSON", e);
            return null;
        }
    }
}
