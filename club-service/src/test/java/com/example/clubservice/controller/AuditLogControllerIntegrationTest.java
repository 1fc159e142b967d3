package com.example.clubservice.controller;

import com.example.clubservice.audit.AuditLogStore;
import com.example.clubservice.entity.AuditAction;
import com.example.clubservice.entity.AuditLog;
import com.example.clubservice.entity.Member;
import com.example.clubservice.entity.MemberStatus;
import com.example.clubservice.entity.Role;
import com.example.clubservice.repository.AuditLogRepository;
import com.example.clubservice.repository.MemberRepository;
import com.example.clubservice.repository.RefreshTokenRepository;
import com.example.clubservice.service.JwtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuditLogControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MemberRepository memberRepository;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private AuditLogStore auditLogStore;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Member admin;
    private Member coach;
    private Member member;

    @BeforeEach
    void setUp() {
        refreshTokenRepository.deleteAll();
        auditLogRepository.deleteAll();
        memberRepository.deleteAll();

        admin = memberRepository.save(member("admin@club.test", Role.ADMIN, "org-1"));
        coach = memberRepository.save(member("coach@club.test", Role.COACH, "org-1"));
        member = memberRepository.save(member("member@club.test", Role.MEMBER, "org-1"));
    }

    private Member member(String email, Role role, String organizationId) {
        Member m = new Member();
        m.setOrganizationId(organizationId);
        m.setEmail(email);
        m.setPasswordHash("not-used");
        m.setFirstName("Test");
        m.setLastName(role.name());
        m.setRole(role);
        m.setStatus(MemberStatus.ACTIVE);
        return m;
    }

    private String bearer(Member m) {
        return "Bearer " + jwtService.generateAccessToken(m);
    }

    private AuditLog entry(String organizationId, Member actor, AuditAction action, String entityType,
                           String entityId, boolean success) {
        AuditLog.Builder builder = AuditLog.builder()
                .organizationId(organizationId)
                .actor(actor.getId(), actor.getEmail(), actor.getRole())
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .httpMethod("POST")
                .ipAddress("10.0.0.1")
                .description(actor.getEmail() + " " + action.pastTense() + " " + entityType);
        return auditLogStore.append(success ? builder.success().build() : builder.failure("boom").build());
    }

    private void backdate(AuditLog log, int days) {
        jdbcTemplate.update("UPDATE audit_logs SET created_at = ? WHERE id = ?",
                LocalDateTime.now().minusDays(days), log.getId());
    }

    @Test
    void coachSearchesOwnOrganizationOnly() throws Exception {
        entry("org-1", coach, AuditAction.CREATE, "Course", "1", true);
        entry("org-1", coach, AuditAction.UPDATE, "Course", "1", true);
        entry("org-2", coach, AuditAction.CREATE, "Course", "9", true);

        mockMvc.perform(get("/api/audit-logs")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.limit").value(50))
                .andExpect(jsonPath("$.data[0].organization_id").value("org-1"));

        mockMvc.perform(get("/api/audit-logs")
                        .header("Authorization", bearer(coach))
                        .param("action", "UPDATE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].action").value("UPDATE"));
    }

    @Test
    void memberRoleCannotReadTrail() throws Exception {
        mockMvc.perform(get("/api/audit-logs")
                        .header("Authorization", bearer(member)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        assertEquals(0, auditLogRepository.count());
    }

    @Test
    void exportIsAdminOnly() throws Exception {
        entry("org-1", coach, AuditAction.CREATE, "Course", "1", true);

        mockMvc.perform(get("/api/audit-logs/export")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/audit-logs/export")
                        .header("Authorization", bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void entryOfAnotherOrganizationIsNotFound() throws Exception {
        AuditLog foreign = entry("org-2", coach, AuditAction.CREATE, "Course", "9", true);
        AuditLog own = entry("org-1", coach, AuditAction.CREATE, "Course", "1", true);

        mockMvc.perform(get("/api/audit-logs/{id}", foreign.getId())
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        mockMvc.perform(get("/api/audit-logs/{id}", own.getId())
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entity_id").value("1"));
    }

    @Test
    void entityAndUserHistory() throws Exception {
        entry("org-1", coach, AuditAction.CREATE, "Course", "1", true);
        entry("org-1", admin, AuditAction.UPDATE, "Course", "1", true);
        entry("org-1", admin, AuditAction.CREATE, "Course", "2", true);

        mockMvc.perform(get("/api/audit-logs/entity/{type}/{id}", "Course", "1")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/audit-logs/user/{userId}", admin.getId())
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void failedLoginsAndStats() throws Exception {
        entry("org-1", member, AuditAction.FAILED_LOGIN, "Member", String.valueOf(member.getId()), false);
        entry("org-1", coach, AuditAction.CREATE, "Course", "1", true);
        entry("org-1", coach, AuditAction.CREATE, "Course", "2", true);

        mockMvc.perform(get("/api/audit-logs/failed-logins")
                        .header("Authorization", bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].user_email").value("member@club.test"));

        mockMvc.perform(get("/api/audit-logs/stats")
                        .header("Authorization", bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.success").value(2))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.by_action.CREATE").value(2))
                .andExpect(jsonPath("$.by_entity_type.Course").value(2))
                .andExpect(jsonPath("$.period_days").value(30));
    }

    @Test
    void purgeDeletesOnlyOldEntriesOfOwnOrganization() throws Exception {
        backdate(entry("org-1", coach, AuditAction.CREATE, "Course", "1", true), 400);
        entry("org-1", coach, AuditAction.CREATE, "Course", "2", true);
        backdate(entry("org-2", coach, AuditAction.CREATE, "Course", "9", true), 400);

        mockMvc.perform(post("/api/audit-logs/purge")
                        .header("Authorization", bearer(admin))
                        .param("retention_days", "365"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(1))
                .andExpect(jsonPath("$.retention_days").value(365));

        List<AuditLog> remaining = auditLogRepository.findAll();
        assertEquals(3, remaining.size());
        assertTrue(remaining.stream().anyMatch(e -> "org-2".equals(e.getOrganizationId())));

        AuditLog purge = remaining.stream()
                .filter(e -> "AuditLog".equals(e.getEntityType()))
                .findFirst()
                .orElseThrow();
        assertEquals(AuditAction.DELETE, purge.getAction());
        assertEquals(admin.getId(), purge.getActorId());
    }

    @Test
    void purgeRejectsNonPositiveRetention() throws Exception {
        mockMvc.perform(post("/api/audit-logs/purge")
                        .header("Authorization", bearer(admin))
                        .param("retention_days", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void coachCannotPurge() throws Exception {
        mockMvc.perform(post("/api/audit-logs/purge")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isForbidden());

        assertEquals(0, auditLogRepository.count());
    }

    @Test
    void failedLoginsAndStatsAreAdminOnly() throws Exception {
        mockMvc.perform(get("/api/audit-logs/failed-logins")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        mockMvc.perform(get("/api/audit-logs/stats")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isForbidden());

        assertEquals(0, auditLogRepository.count());
    }

    @Test
    void recentReturnsLatestEntriesOfWindow() throws Exception {
        backdate(entry("org-1", coach, AuditAction.CREATE, "Course", "1", true), 3);
        entry("org-1", coach, AuditAction.UPDATE, "Course", "1", true);
        entry("org-1", admin, AuditAction.DELETE, "Course", "2", true);
        entry("org-2", coach, AuditAction.CREATE, "Course", "9", true);

        mockMvc.perform(get("/api/audit-logs/recent")
                        .header("Authorization", bearer(coach)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].action").value("DELETE"))
                .andExpect(jsonPath("$[1].action").value("UPDATE"));

        mockMvc.perform(get("/api/audit-logs/recent")
                        .header("Authorization", bearer(member)))
                .andExpect(status().isForbidden());
    }
}
