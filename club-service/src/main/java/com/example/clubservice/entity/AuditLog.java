package com.example.clubservice.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Audit Log entity recording one authenticated action and its outcome.
 *
 * Design Decision:
 * - Immutable: no setters, every column is updatable = false. Rows leave the table only
 *   through the retention purge.
 * - Denormalized: actor email/role are snapshots taken at action time, never joined live.
 * - JSON values: old_values/new_values/metadata stored as TEXT, already redacted.
 * - organization_id is always the actor's organization, never a value from the payload.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_org_created_at", columnList = "organization_id, created_at"),
    @Index(name = "idx_audit_actor_created_at", columnList = "actor_id, created_at"),
    @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
    @Index(name = "idx_audit_action_created_at", columnList = "action, created_at")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false, updatable = false, length = 64)
    private String organizationId;

    // Who
    @Column(name = "actor_id", updatable = false)
    private Long actorId;

    @Column(name = "actor_email", updatable = false, length = 255)
    private String actorEmail;

    @Column(name = "actor_role", updatable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private Role actorRole;

    // What
    @Column(nullable = false, updatable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private AuditAction action;

    @Column(name = "entity_type", nullable = false, updatable = false, length = 100)
    private String entityType;

    @Column(name = "entity_id", updatable = false, length = 100)
    private String entityId;

    @Column(name = "old_values", updatable = false, columnDefinition = "TEXT")
    private String oldValues;

    @Column(name = "new_values", updatable = false, columnDefinition = "TEXT")
    private String newValues;

    // Request context
    @Column(name = "http_method", updatable = false, length = 10)
    private String httpMethod;

    @Column(name = "request_url", updatable = false, length = 255)
    private String requestUrl;

    @Column(name = "ip_address", updatable = false, length = 45)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = 500)
    private String userAgent;

    // Outcome
    @Column(nullable = false, updatable = false)
    private boolean success = true;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String description;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String metadata;

    // When
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    // JPA only - use Builder
    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.organizationId = builder.organizationId;
        this.actorId = builder.actorId;
        this.actorEmail = builder.actorEmail;
        this.actorRole = builder.actorRole;
        this.action = builder.action;
        this.entityType = builder.entityType;
        this.entityId = builder.entityId;
        this.oldValues = builder.oldValues;
        this.newValues = builder.newValues;
        this.httpMethod = builder.httpMethod;
        this.requestUrl = builder.requestUrl;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
        this.success = builder.success;
        this.errorMessage = builder.errorMessage;
        this.description = builder.description;
        this.metadata = builder.metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String organizationId;
        private Long actorId;
        private String actorEmail;
        private Role actorRole;
        private AuditAction action;
        private String entityType;
        private String entityId;
        private String oldValues;
        private String newValues;
        private String httpMethod;
        private String requestUrl;
        private String ipAddress;
        private String userAgent;
        private boolean success = true;
        private String errorMessage;
        private String description;
        private String metadata;

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder actor(Long actorId, String actorEmail, Role actorRole) {
            this.actorId = actorId;
            this.actorEmail = truncate(actorEmail, 255);
            this.actorRole = actorRole;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = truncate(entityType, 100);
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = truncate(entityId, 100);
            return this;
        }

        public Builder oldValues(String oldValues) {
            this.oldValues = oldValues;
            return this;
        }

        public Builder newValues(String newValues) {
            this.newValues = newValues;
            return this;
        }

        public Builder httpMethod(String httpMethod) {
            this.httpMethod = truncate(httpMethod, 10);
            return this;
        }

        public Builder requestUrl(String requestUrl) {
            this.requestUrl = truncate(requestUrl, 255);
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = truncate(ipAddress, 45);
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = truncate(userAgent, 500);
            return this;
        }

        public Builder success() {
            this.success = true;
            this.errorMessage = null;
            return this;
        }

        public Builder failure(String errorMessage) {
            this.success = false;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder metadata(String metadata) {
            this.metadata = metadata;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }

        // Bounded columns take client controlled text (URL, headers); cut to the column width
        private static String truncate(String value, int maxLength) {
            if (value == null || value.length() <= maxLength) {
                return value;
            }
            return value.substring(0, maxLength);
        }
    }

    // Getters only (immutable)
    public Long getId() { return id; }
    public String getOrganizationId() { return organizationId; }
    public Long getActorId() { return actorId; }
    public String getActorEmail() { return actorEmail; }
    public Role getActorRole() { return actorRole; }
    public AuditAction getAction() { return action; }
    public String getEntityType() { return entityType; }
    public String getEntityId() { return entityId; }
    public String getOldValues() { return oldValues; }
    public String getNewValues() { return newValues; }
    public String getHttpMethod() { return httpMethod; }
    public String getRequestUrl() { return requestUrl; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public boolean isSuccess() { return success; }
    public String getErrorMessage() { return errorMessage; }
    public String getDescription() { return description; }
    public String getMetadata() { return metadata; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
