package com.example.clubservice.repository;

import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.entity.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for AuditLog entity.
 *
 * Design Decision:
 * - Append + read only: the single delete is the organization-scoped retention purge
 * - Every query is scoped by organization_id
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    /**
     * Filtered search, newest first.
     * Use case: admin/coach browsing the organization's trail.
     */
    @Query("SELECT a FROM AuditLog a WHERE a.organizationId = :organizationId " +
            "AND (:actorId IS NULL OR a.actorId = :actorId) " +
            "AND (:action IS NULL OR a.action = :action) " +
            "AND (:entityType IS NULL OR a.entityType = :entityType) " +
            "AND (:entityId IS NULL OR a.entityId = :entityId) " +
            "AND (:ipAddress IS NULL OR a.ipAddress = :ipAddress) " +
            "AND (:from IS NULL OR a.createdAt >= :from) " +
            "AND (:to IS NULL OR a.createdAt <= :to) " +
            "ORDER BY a.createdAt DESC, a.id DESC")
    Page<AuditLog> search(
            @Param("organizationId") String organizationId,
            @Param("actorId") Long actorId,
            @Param("action") AuditAction action,
            @Param("entityType") String entityType,
            @Param("entityId") String entityId,
            @Param("ipAddress") String ipAddress,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            Pageable pageable);

    Optional<AuditLog> findByIdAndOrganizationId(Long id, String organizationId);

    /**
     * History of a single business entity.
     */
    List<AuditLog> findByOrganizationIdAndEntityTypeAndEntityIdOrderByCreatedAtDesc(
            String organizationId, String entityType, String entityId);

    /**
     * Actions performed by one member, newest first, bounded by the pageable.
     */
    List<AuditLog> findByOrganizationIdAndActorIdOrderByCreatedAtDesc(
            String organizationId, Long actorId, Pageable pageable);

    /**
     * Recent activity feed.
     */
    List<AuditLog> findTop100ByOrganizationIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(
            String organizationId, LocalDateTime since);

    List<AuditLog> findByOrganizationIdAndActionAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            String organizationId, AuditAction action, LocalDateTime since);

    List<AuditLog> findByOrganizationIdAndCreatedAtGreaterThanEqual(String organizationId, LocalDateTime since);

    /**
     * Compliance export: the full window in chronological order.
     */
    @Query("SELECT a FROM AuditLog a WHERE a.organizationId = :organizationId " +
            "AND (:from IS NULL OR a.createdAt >= :from) " +
            "AND (:to IS NULL OR a.createdAt <= :to) " +
            "ORDER BY a.createdAt ASC, a.id ASC")
    List<AuditLog> findForExport(
            @Param("organizationId") String organizationId,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to);

    /**
     * Retention purge. Operator-invoked only.
     *
     * @return number of deleted rows
     */
    @Modifying
    @Query("DELETE FROM AuditLog a WHERE a.organizationId = :organizationId AND a.createdAt < :cutoff")
    int deleteOlderThan(@Param("organizationId") String organizationId, @Param("cutoff") LocalDateTime cutoff);
}
