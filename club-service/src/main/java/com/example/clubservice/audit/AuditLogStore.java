package com.example.clubservice.audit;

import com.example.clubservice.dto.AuditLogDto;
import com.example.clubservice.dto.AuditLogPageResponse;
import com.example.clubservice.dto.AuditLogQuery;
import com.example.clubservice.dto.AuditStatsResponse;
import com.example.clubservice.dto.PurgeResponse;
import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.entity.AuditLog;
import com.example.clubservice.exception.AuditLogNotFoundException;
import com.example.clubservice.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Append-only store of audit entries.
 *
 * Every read and the purge are scoped to one organization; the caller passes the
 * organization of the verified principal.
 */
@Service
@Slf4j
public class AuditLogStore {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditLogStore(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Persist one entry in its own transaction, independent of the caller's.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditLog append(AuditLog entry) {
        AuditLog saved = auditLogRepository.save(entry);
        log.debug("Audit log created: {} {} on {}:{}",
                saved.getAction(), saved.isSuccess() ? "SUCCESS" : "FAILURE",
                saved.getEntityType(), saved.getEntityId());
        return saved;
    }

    /**
     * Filtered search, newest first.
     *
     * @param limit  page size, clamped to [1, 500]
     * @param offset number of entries to skip, rounded down to a page boundary
     */
    @Transactional(readOnly = true)
    public AuditLogPageResponse search(String organizationId, AuditLogQuery query, int limit, int offset) {
        int pageSize = clampLimit(limit);
        int safeOffset = Math.max(0, offset);
        Page<AuditLog> page = auditLogRepository.search(
                organizationId,
                query.userId(),
                query.action(),
                query.entityType(),
                query.entityId(),
                query.ipAddress(),
                query.startDate(),
                query.endDate(),
                PageRequest.of(safeOffset / pageSize, pageSize));

        return new AuditLogPageResponse(toDtos(page.getContent()), page.getTotalElements(), pageSize, safeOffset);
    }

    @Transactional(readOnly = true)
    public AuditLogDto findOne(String organizationId, Long id) {
        return auditLogRepository.findByIdAndOrganizationId(id, organizationId)
                .map(this::toDto)
                .orElseThrow(() -> new AuditLogNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<AuditLogDto> findByEntity(String organizationId, String entityType, String entityId) {
        return toDtos(auditLogRepository.findByOrganizationIdAndEntityTypeAndEntityIdOrderByCreatedAtDesc(
                organizationId, entityType, entityId));
    }

    @Transactional(readOnly = true)
    public List<AuditLogDto> findByUser(String organizationId, Long userId, int limit) {
        return toDtos(auditLogRepository.findByOrganizationIdAndActorIdOrderByCreatedAtDesc(
                organizationId, userId, PageRequest.of(0, clampLimit(limit))));
    }

    /**
     * Entries of the last {@code hours} hours, newest first, capped at 100.
     */
    @Transactional(readOnly = true)
    public List<AuditLogDto> findRecent(String organizationId, int hours) {
        LocalDateTime since = LocalDateTime.now().minusHours(Math.max(1, hours));
        return toDtos(auditLogRepository
                .findTop100ByOrganizationIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(organizationId, since));
    }

    /**
     * FAILED_LOGIN entries of the last {@code hours} hours.
     */
    @Transactional(readOnly = true)
    public List<AuditLogDto> findFailedLogins(String organizationId, int hours) {
        LocalDateTime since = LocalDateTime.now().minusHours(Math.max(1, hours));
        return toDtos(auditLogRepository
                .findByOrganizationIdAndActionAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                        organizationId, AuditAction.FAILED_LOGIN, since));
    }

    /**
     * Compliance export of a time window, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditLogDto> export(String organizationId, LocalDateTime from, LocalDateTime to) {
        return toDtos(auditLogRepository.findForExport(organizationId, from, to));
    }

    @Transactional(readOnly = true)
    public AuditStatsResponse stats(String organizationId, int days) {
        int periodDays = Math.max(1, days);
        List<AuditLog> entries = auditLogRepository.findByOrganizationIdAndCreatedAtGreaterThanEqual(
                organizationId, LocalDateTime.now().minusDays(periodDays));

        Map<String, Long> byAction = new TreeMap<>();
        Map<String, Long> byEntityType = new TreeMap<>();
        Map<String, Long> byUser = new TreeMap<>();
        long success = 0;

        for (AuditLog entry : entries) {
            if (entry.isSuccess()) {
                success++;
            }
            byAction.merge(entry.getAction().name(), 1L, Long::sum);
            byEntityType.merge(entry.getEntityType(), 1L, Long::sum);
            String user = entry.getActorEmail() != null ? entry.getActorEmail() : String.valueOf(entry.getActorId());
            byUser.merge(user, 1L, Long::sum);
        }

        return new AuditStatsResponse(
                entries.size(),
                success,
                entries.size() - success,
                byAction,
                byEntityType,
                byUser,
                periodDays);
    }

    /**
     * Delete the organization's entries created before now minus {@code retentionDays}.
     *
     * @throws IllegalArgumentException if retentionDays is not positive
     */
    @Transactional
    public PurgeResponse purgeOlderThan(String organizationId, int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retention_days must be at least 1");
        }
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int deleted = auditLogRepository.deleteOlderThan(organizationId, cutoff);
        log.warn("Purged {} audit log(s) of organization {} older than {}", deleted, organizationId, cutoff);
        return new PurgeResponse(deleted, cutoff, retentionDays);
    }

    private static int clampLimit(int limit) {
        if (limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private List<AuditLogDto> toDtos(List<AuditLog> entries) {
        return entries.stream().map(this::toDto).toList();
    }

    private AuditLogDto toDto(AuditLog entry) {
        return AuditLogDto.fromEntity(entry, objectMapper);
    }
}
