package com.example.clubservice.service;

import com.example.clubservice.entity.Member;
import com.example.clubservice.entity.Role;
import com.example.clubservice.security.AuthenticatedPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * JWT Service for access token generation and verification.
 *
 * Algorithm: HS256
 * Signing Key: jwt.secret (at least 32 bytes)
 * Access Token TTL: 15 minutes
 *
 * Access tokens are stateless: logout does not revoke them, they simply expire.
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ORGANIZATION_ID = "organization_id";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String TOKEN_TYPE_ACCESS = "ACCESS";

    private final SecretKey secretKey;
    private final long accessTokenExpiration;

    public JwtService(
            @Value("${jwt.secret}") String jwtSecret,
            @Value("${jwt.access-token-expiration:900000}") long accessTokenExpiration) {
        // HS256 requires at least 256 bits (32 bytes) key
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpiration = accessTokenExpiration; // Default: 900000ms = 15 minutes
    }

    /**
     * Generate Access Token (JWT) for an authenticated member.
     *
     * Claims:
     * - sub: Member ID
     * - email: Member email
     * - organization_id: tenant of the member
     * - role: admin | coach | member
     * - token_type: ACCESS
     * - iat / exp
     *
     * @param member Authenticated member
     * @return JWT access token string
     */
    public String generateAccessToken(Member member) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + accessTokenExpiration);

        return Jwts.builder()
                .subject(String.valueOf(member.getId()))
                .claim(CLAIM_EMAIL, member.getEmail())
                .claim(CLAIM_ORGANIZATION_ID, member.getOrganizationId())
                .claim(CLAIM_ROLE, member.getRole().name())
                .claim(CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(secretKey)
                .compact();
    }

    /**
     * Verify signature, expiration and token type, then rebuild the principal from the claims.
     *
     * @param token JWT access token
     * @return the principal, or empty when the token cannot be trusted
     */
    public Optional<AuthenticatedPrincipal> parseAccessToken(String token) {
        try {
            Claims claims = extractAllClaims(token);
            if (!TOKEN_TYPE_ACCESS.equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
                log.debug("Rejected JWT with unexpected token_type");
                return Optional.empty();
            }
            String organizationId = claims.get(CLAIM_ORGANIZATION_ID, String.class);
            String role = claims.get(CLAIM_ROLE, String.class);
            if (organizationId == null || role == null) {
                log.debug("Rejected JWT without tenant or role claim");
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedPrincipal(
                    Long.parseLong(claims.getSubject()),
                    organizationId,
                    Role.fromValue(role),
                    claims.get(CLAIM_EMAIL, String.class)));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Access token lifetime in seconds, as reported in expires_in.
     */
    public long getAccessTokenTtlSeconds() {
        return accessTokenExpiration / 1000;
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
