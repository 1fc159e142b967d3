package com.example.clubservice.service;

import com.example.clubservice.dto.LoginResponse;
import com.example.clubservice.dto.PrincipalDto;
import com.example.clubservice.entity.Member;
import com.example.clubservice.entity.RefreshToken;
import com.example.clubservice.exception.TokenExpiredException;
import com.example.clubservice.exception.TokenInvalidException;
import com.example.clubservice.exception.TokenRevokedException;
import com.example.clubservice.repository.RefreshTokenRepository;
import com.example.clubservice.security.ClientInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Base64;

/**
 * Refresh Token Service: issuance, single-use rotation, revocation and expiry sweep.
 *
 * Refresh Token TTL: 30 days
 * Format: 32 random bytes, base64url encoded (opaque, NOT a JWT)
 */
@Service
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    private static final int TOKEN_BYTES = 32;

    private final RefreshTokenRepository refreshTokenRepository;
    private final JwtService jwtService;
    private final long refreshTokenExpiration;
    private final SecureRandom secureRandom = new SecureRandom();

    public RefreshTokenService(
            RefreshTokenRepository refreshTokenRepository,
            JwtService jwtService,
            @Value("${jwt.refresh-token-expiration:2592000000}") long refreshTokenExpiration) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.jwtService = jwtService;
        this.refreshTokenExpiration = refreshTokenExpiration; // Default: 2592000000ms = 30 days
    }

    /**
     * Create and persist a new refresh token for a member.
     *
     * @param member Authenticated member
     * @param client Client metadata stored with the token
     * @return opaque refresh token secret
     */
    @Transactional
    public String createRefreshToken(Member member, ClientInfo client) {
        LocalDateTime now = LocalDateTime.now();
        RefreshToken refreshToken = new RefreshToken(
                member,
                generateSecret(),
                now,
                now.plus(Duration.ofMillis(refreshTokenExpiration)),
                client.userAgent(),
                client.ipAddress());

        refreshTokenRepository.save(refreshToken);

        return refreshToken.getToken();
    }

    /**
     * Rotate a refresh token and issue a new token pair.
     *
     * Steps:
     * 1. Find token in database
     * 2. Reject revoked token (replay of a consumed token)
     * 3. Reject expired token
     * 4. Reject when the member is no longer ACTIVE
     * 5. Revoke the presented token with a conditional update
     * 6. Issue new refresh + access token
     *
     * @param tokenString presented refresh token secret
     * @param client      client metadata for the new token
     * @return LoginResponse with the new pair
     * @throws TokenInvalidException if token not found or member inactive (401)
     * @throws TokenRevokedException if token was already consumed or revoked (401)
     * @throws TokenExpiredException if token expired (401)
     */
    @Transactional
    public LoginResponse refreshToken(String tokenString, ClientInfo client) {
        LocalDateTime now = LocalDateTime.now();

        RefreshToken refreshToken = refreshTokenRepository.findByToken(tokenString)
                .orElseThrow(TokenInvalidException::new);

        if (refreshToken.isRevoked()) {
            log.warn("SECURITY: Revoked refresh token {} presented for member {}",
                    refreshToken.getId(), refreshToken.getMember().getId());
            throw new TokenRevokedException();
        }

        if (refreshToken.isExpired(now)) {
            throw new TokenExpiredException();
        }

        Member member = refreshToken.getMember();
        if (!member.isActive()) {
            log.warn("SECURITY: Member {} with status {} tried to refresh", member.getId(), member.getStatus());
            throw new TokenInvalidException("Member is not active");
        }

        // Row count 0: a concurrent rotation consumed this token first
        int revoked = refreshTokenRepository.revokeIfActive(refreshToken.getId(), now);
        if (revoked == 0) {
            log.warn("SECURITY: Concurrent rotation lost for refresh token {}", refreshToken.getId());
            throw new TokenRevokedException();
        }

        String newRefreshToken = createRefreshToken(member, client);
        String newAccessToken = jwtService.generateAccessToken(member);

        log.info("Refresh token rotated for member {}", member.getId());

        return LoginResponse.of(newAccessToken, newRefreshToken,
                jwtService.getAccessTokenTtlSeconds(), PrincipalDto.fromMember(member));
    }

    /**
     * Revoke every outstanding refresh token of a member.
     * Used by logout.
     *
     * @return number of revoked tokens
     */
    @Transactional
    public int revokeAllTokens(Long memberId) {
        int revoked = refreshTokenRepository.revokeAllByMemberId(memberId, LocalDateTime.now());
        log.info("Revoked {} refresh token(s) for member {}", revoked, memberId);
        return revoked;
    }

    /**
     * Delete every refresh token past its expiry, revoked or not.
     *
     * @return number of deleted rows
     */
    @Transactional
    public int purgeExpired() {
        return refreshTokenRepository.deleteExpired(LocalDateTime.now());
    }

    private String generateSecret() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
