package com.example.clubservice.dto;

import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.entity.AuditLog;
import com.example.clubservice.entity.Role;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Audit entry as returned by the audit API. JSON columns are expanded back to objects.
 */
public record AuditLogDto(
    @JsonProperty("id") Long id,
    @JsonProperty("organization_id") String organizationId,
    @JsonProperty("user_id") Long actorId,
    @JsonProperty("user_email") String actorEmail,
    @JsonProperty("user_role") Role actorRole,
    @JsonProperty("action") AuditAction action,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("old_values") Map<String, Object> oldValues,
    @JsonProperty("new_values") Map<String, Object> newValues,
    @JsonProperty("http_method") String httpMethod,
    @JsonProperty("request_url") String requestUrl,
    @JsonProperty("ip_address") String ipAddress,
    @JsonProperty("user_agent") String userAgent,
    @JsonProperty("success") boolean success,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("description") String description,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public static AuditLogDto fromEntity(AuditLog log, ObjectMapper objectMapper) {
        return new AuditLogDto(
            log.getId(),
            log.getOrganizationId(),
            log.getActorId(),
            log.getActorEmail(),
            log.getActorRole(),
            log.getAction(),
            log.getEntityType(),
            log.getEntityId(),
            readJson(log.getOldValues(), objectMapper),
            readJson(log.getNewValues(), objectMapper),
            log.getHttpMethod(),
            log.getRequestUrl(),
            log.getIpAddress(),
            log.getUserAgent(),
            log.isSuccess(),
            log.getErrorMessage(),
            log.getDescription(),
            readJson(log.getMetadata(), objectMapper),
            log.getCreatedAt()
        );
    }

    private static Map<String, Object> readJson(String json, ObjectMapper objectMapper) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            // Stored values are written by AuditRecorder; keep the raw text visible if it ever is not an object
            return Map.of("raw", json);
        }
    }
}
