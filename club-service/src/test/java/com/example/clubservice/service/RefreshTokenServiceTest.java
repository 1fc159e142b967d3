package com.example.clubservice.service;

import com.example.clubservice.dto.LoginResponse;
import com.example.clubservice.entity.Member;
import com.example.clubservice.entity.MemberStatus;
import com.example.clubservice.entity.RefreshToken;
import com.example.clubservice.entity.Role;
import com.example.clubservice.exception.CredentialException;
import com.example.clubservice.exception.TokenExpiredException;
import com.example.clubservice.exception.TokenInvalidException;
import com.example.clubservice.exception.TokenRevokedException;
import com.example.clubservice.repository.AuditLogRepository;
import com.example.clubservice.repository.MemberRepository;
import com.example.clubservice.repository.RefreshTokenRepository;
import com.example.clubservice.security.ClientInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Refresh token lifecycle against the real persistence layer.
 */
@SpringBootTest
@ActiveProfiles("test")
class RefreshTokenServiceTest {

    private static final ClientInfo CLIENT = new ClientInfo("10.0.0.1", "JUnit");

    @Autowired
    private RefreshTokenService refreshTokenService;

    @Autowired
    private AuthService authService;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private MemberRepository memberRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private Member member;

    @BeforeEach
    void setUp() {
        refreshTokenRepository.deleteAll();
        auditLogRepository.deleteAll();
        memberRepository.deleteAll();

        member = memberRepository.save(newMember("rotation@club.test", MemberStatus.ACTIVE));
    }

    private static Member newMember(String email, MemberStatus status) {
        Member m = new Member();
        m.setOrganizationId("org-1");
        m.setEmail(email);
        m.setPasswordHash("$2a$10$notusedinthesetests");
        m.setFirstName("Test");
        m.setLastName("Member");
        m.setRole(Role.MEMBER);
        m.setStatus(status);
        return m;
    }

    @Test
    void rotationConsumesPresentedToken() {
        String r1 = refreshTokenService.createRefreshToken(member, CLIENT);

        LoginResponse response = refreshTokenService.refreshToken(r1, CLIENT);
        String r2 = response.refreshToken();

        assertNotEquals(r1, r2);
        assertNotNull(response.accessToken());
        assertEquals(900, response.expiresIn());
        assertEquals("org-1", response.principal().organizationId());

        RefreshToken consumed = refreshTokenRepository.findByToken(r1).orElseThrow();
        assertTrue(consumed.isRevoked());
        assertNotNull(consumed.getRevokedAt());
    }

    @Test
    void replayOfConsumedTokenFailsAndChildStaysValid() {
        String r1 = refreshTokenService.createRefreshToken(member, CLIENT);
        String r2 = refreshTokenService.refreshToken(r1, CLIENT).refreshToken();

        assertThrows(TokenRevokedException.class, () -> refreshTokenService.refreshToken(r1, CLIENT));

        LoginResponse third = refreshTokenService.refreshToken(r2, CLIENT);
        assertNotEquals(r2, third.refreshToken());
    }

    @Test
    void expiredTokenIsRejected() {
        LocalDateTime now = LocalDateTime.now();
        refreshTokenRepository.save(new RefreshToken(member, "expired-secret",
                now.minusDays(31), now.minusDays(1), "JUnit", "10.0.0.1"));

        assertThrows(TokenExpiredException.class, () -> refreshTokenService.refreshToken("expired-secret", CLIENT));
    }

    @Test
    void unknownTokenIsRejected() {
        assertThrows(TokenInvalidException.class, () -> refreshTokenService.refreshToken("no-such-token", CLIENT));
    }

    @Test
    void inactiveMemberCannotRefresh() {
        Member suspended = memberRepository.save(newMember("suspended@club.test", MemberStatus.SUSPENDED));
        String token = refreshTokenService.createRefreshToken(suspended, CLIENT);

        assertThrows(TokenInvalidException.class, () -> refreshTokenService.refreshToken(token, CLIENT));
    }

    @Test
    void tokensCarryClientMetadataAndThirtyDayExpiry() {
        String token = refreshTokenService.createRefreshToken(member, CLIENT);

        RefreshToken stored = refreshTokenRepository.findByToken(token).orElseThrow();
        assertEquals("JUnit", stored.getUserAgent());
        assertEquals("10.0.0.1", stored.getIpAddress());
        assertEquals(30, Duration.between(stored.getIssuedAt(), stored.getExpiresAt()).toDays());
        assertTrue(token.length() >= 43);
    }

    @Test
    void logoutRevokesEveryOutstandingToken() {
        String a = refreshTokenService.createRefreshToken(member, CLIENT);
        String b = refreshTokenService.createRefreshToken(member, CLIENT);
        refreshTokenService.createRefreshToken(member, CLIENT);

        authService.logout(member.getId());

        List<RefreshToken> tokens = refreshTokenRepository.findAll();
        assertEquals(3, tokens.size());
        assertTrue(tokens.stream().allMatch(RefreshToken::isRevoked));
        assertThrows(TokenRevokedException.class, () -> refreshTokenService.refreshToken(a, CLIENT));
        assertThrows(TokenRevokedException.class, () -> refreshTokenService.refreshToken(b, CLIENT));
    }

    @Test
    void purgeRemovesOnlyExpiredRows() {
        LocalDateTime now = LocalDateTime.now();
        refreshTokenRepository.save(new RefreshToken(member, "old-secret",
                now.minusDays(40), now.minusDays(10), null, null));
        String live = refreshTokenService.createRefreshToken(member, CLIENT);

        int deleted = refreshTokenService.purgeExpired();

        assertEquals(1, deleted);
        assertTrue(refreshTokenRepository.findByToken("old-secret").isEmpty());
        assertTrue(refreshTokenRepository.findByToken(live).isPresent());
    }

    @Test
    void concurrentRefreshOfSameTokenLeavesItConsumed() throws Exception {
        String r1 = refreshTokenService.createRefreshToken(member, CLIENT);
        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        refreshTokenService.refreshToken(r1, CLIENT);
                        return true;
                    } catch (CredentialException e) {
                        return false;
                    }
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                try {
                    if (result.get(30, TimeUnit.SECONDS)) {
                        successes++;
                    }
                } catch (ExecutionException e) {
                    // Lock contention surfaced by the database counts as a lost race
                }
            }

            assertTrue(successes >= 1, "at least one rotation must win");
        } finally {
            executor.shutdownNow();
        }

        assertThrows(TokenRevokedException.class, () -> refreshTokenService.refreshToken(r1, CLIENT));
        assertTrue(refreshTokenRepository.findByToken(r1).orElseThrow().isRevoked());
    }
}
