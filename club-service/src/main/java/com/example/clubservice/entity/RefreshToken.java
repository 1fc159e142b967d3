package com.example.clubservice.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * RefreshToken entity mapping to 'refresh_tokens' table.
 *
 * Rows are append-only except for the revocation flag: secret and owner never change.
 * A row is removed only by the expiry sweep.
 */
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_token", columnList = "token"),
    @Index(name = "idx_refresh_member_revoked", columnList = "member_id, revoked"),
    @Index(name = "idx_refresh_expires_at", columnList = "expires_at")
})
public class RefreshToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "member_id", nullable = false, updatable = false)
    private Member member;

    @Column(nullable = false, unique = true, updatable = false, length = 255)
    private String token;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private LocalDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean revoked = false;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Column(name = "user_agent", updatable = false, length = 500)
    private String userAgent;

    @Column(name = "ip_address", updatable = false, length = 45)
    private String ipAddress;

    // Default constructor (JPA requirement)
    protected RefreshToken() {
    }

    public RefreshToken(Member member, String token, LocalDateTime issuedAt, LocalDateTime expiresAt,
                        String userAgent, String ipAddress) {
        this.member = member;
        this.token = token;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.userAgent = userAgent;
        this.ipAddress = ipAddress;
    }

    public Long getId() {
        return id;
    }

    public Member getMember() {
        return member;
    }

    public String getToken() {
        return token;
    }

    public LocalDateTime getIssuedAt() {
        return issuedAt;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public LocalDateTime getRevokedAt() {
        return revokedAt;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    /**
     * Expired once now reaches expires_at.
     */
    public boolean isExpired(LocalDateTime now) {
        return !now.isBefore(this.expiresAt);
    }
}
