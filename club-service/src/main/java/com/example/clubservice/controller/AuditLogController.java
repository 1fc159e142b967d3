package com.example.clubservice.controller;

import com.example.clubservice.audit.AuditLogStore;
import com.example.clubservice.dto.AuditLogDto;
import com.example.clubservice.dto.AuditLogPageResponse;
import com.example.clubservice.dto.AuditLogQuery;
import com.example.clubservice.dto.AuditStatsResponse;
import com.example.clubservice.dto.PurgeResponse;
import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.tenant.TenantScopedRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Audit trail of the caller's organization.
 * Reads need ADMIN or COACH; failed logins, stats, export and purge need ADMIN.
 */
@RestController
@RequestMapping("/api/audit-logs")
@Tag(name = "Audit logs", description = "Organization audit trail")
@SecurityRequirement(name = "Bearer Authentication")
@PreAuthorize("hasAnyRole('ADMIN', 'COACH')")
public class AuditLogController {

    private final AuditLogStore auditLogStore;

    public AuditLogController(AuditLogStore auditLogStore) {
        this.auditLogStore = auditLogStore;
    }

    @Operation(summary = "Search audit logs", description = "Filtered, newest first, paginated")
    @GetMapping
    public ResponseEntity<AuditLogPageResponse> search(
            TenantScopedRequest tenant,
            @RequestParam(name = "user_id", required = false) Long userId,
            @RequestParam(name = "action", required = false) AuditAction action,
            @RequestParam(name = "entity_type", required = false) String entityType,
            @RequestParam(name = "entity_id", required = false) String entityId,
            @RequestParam(name = "ip_address", required = false) String ipAddress,
            @Parameter(description = "Start of the window (ISO date-time)")
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @Parameter(description = "End of the window (ISO date-time)")
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(name = "limit", defaultValue = "50") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {

        AuditLogQuery query = new AuditLogQuery(userId, action, entityType, entityId, ipAddress, startDate, endDate);
        return ResponseEntity.ok(auditLogStore.search(tenant.organizationId(), query, limit, offset));
    }

    @Operation(summary = "Recent activity", description = "Last hours, newest first, at most 100 entries")
    @GetMapping("/recent")
    public ResponseEntity<List<AuditLogDto>> recent(
            TenantScopedRequest tenant,
            @RequestParam(name = "hours", defaultValue = "24") int hours) {
        return ResponseEntity.ok(auditLogStore.findRecent(tenant.organizationId(), hours));
    }

    @Operation(summary = "Failed logins of the last hours", description = "ADMIN only.")
    @PreAuthorize("hasRole('ADMIN')")
    @GetMapping("/failed-logins")
    public ResponseEntity<List<AuditLogDto>> failedLogins(
            TenantScopedRequest tenant,
            @RequestParam(name = "hours", defaultValue = "24") int hours) {
        return ResponseEntity.ok(auditLogStore.findFailedLogins(tenant.organizationId(), hours));
    }

    @Operation(summary = "Audit statistics of the last days", description = "ADMIN only.")
    @PreAuthorize("hasRole('ADMIN')")
    @GetMapping("/stats")
    public ResponseEntity<AuditStatsResponse> stats(
            TenantScopedRequest tenant,
            @RequestParam(name = "days", defaultValue = "30") int days) {
        return ResponseEntity.ok(auditLogStore.stats(tenant.organizationId(), days));
    }

    @Operation(summary = "Export a time window for compliance", description = "Oldest first. ADMIN only.")
    @PreAuthorize("hasRole('ADMIN')")
    @GetMapping("/export")
    public ResponseEntity<List<AuditLogDto>> export(
            TenantScopedRequest tenant,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate) {
        return ResponseEntity.ok(auditLogStore.export(tenant.organizationId(), startDate, endDate));
    }

    @Operation(summary = "History of one entity")
    @GetMapping("/entity/{entityType}/{entityId}")
    public ResponseEntity<List<AuditLogDto>> byEntity(
            TenantScopedRequest tenant,
            @PathVariable String entityType,
            @PathVariable String entityId) {
        return ResponseEntity.ok(auditLogStore.findByEntity(tenant.organizationId(), entityType, entityId));
    }

    @Operation(summary = "Actions performed by one member")
    @GetMapping("/user/{userId}")
    public ResponseEntity<List<AuditLogDto>> byUser(
            TenantScopedRequest tenant,
            @PathVariable Long userId,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditLogStore.findByUser(tenant.organizationId(), userId, limit));
    }

    @Operation(summary = "Get one audit entry", responses = {
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown in this organization")
    })
    @GetMapping("/{id}")
    public ResponseEntity<AuditLogDto> findOne(TenantScopedRequest tenant, @PathVariable Long id) {
        return ResponseEntity.ok(auditLogStore.findOne(tenant.organizationId(), id));
    }

    /**
     * Retention purge. Audited itself (DELETE on AuditLog).
     */
    @Operation(summary = "Purge entries older than the retention period", description = "ADMIN only.")
    @PreAuthorize("hasRole('ADMIN')")
    @PostMapping("/purge")
    public ResponseEntity<PurgeResponse> purge(
            TenantScopedRequest tenant,
            @RequestParam(name = "retention_days", defaultValue = "${club.audit.default-retention-days:365}")
            int retentionDays) {
        return ResponseEntity.ok(auditLogStore.purgeOlderThan(tenant.organizationId(), retentionDays));
    }
}
