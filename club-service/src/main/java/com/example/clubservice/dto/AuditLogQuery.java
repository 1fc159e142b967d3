package com.example.clubservice.dto;

import com.example.clubservice.entity.AuditAction;

import java.time.LocalDateTime;

/**
 * Filters for the audit search. Every field is optional.
 */
public record AuditLogQuery(
    Long userId,
    AuditAction action,
    String entityType,
    String entityId,
    String ipAddress,
    LocalDateTime startDate,
    LocalDateTime endDate
) {
    public static AuditLogQuery empty() {
        return new AuditLogQuery(null, null, null, null, null, null, null);
    }
}
