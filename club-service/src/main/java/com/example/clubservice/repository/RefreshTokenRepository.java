package com.example.clubservice.repository;

import com.example.clubservice.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repository for RefreshToken entity.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    /**
     * Find refresh token by its secret, owner loaded eagerly.
     * Used in the refresh flow to validate the presented token.
     */
    @Query("SELECT rt FROM RefreshToken rt JOIN FETCH rt.member WHERE rt.token = :token")
    Optional<RefreshToken> findByToken(@Param("token") String token);

    /**
     * Revoke one token only if nobody revoked it yet.
     * Rotation relies on the row count: 0 means a concurrent refresh already consumed it.
     *
     * @return number of updated rows (0 or 1)
     */
    @Modifying
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
            "WHERE rt.id = :id AND rt.revoked = false")
    int revokeIfActive(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Revoke all refresh tokens of a member.
     * Used by logout.
     *
     * @return number of updated rows
     */
    @Modifying
    @Query("UPDATE RefreshToken rt SET rt.revoked = true, rt.revokedAt = :now " +
            "WHERE rt.member.id = :memberId AND rt.revoked = false")
    int revokeAllByMemberId(@Param("memberId") Long memberId, @Param("now") LocalDateTime now);

    /**
     * Expiry sweep: removes rows past expires_at whatever their revocation state.
     *
     * @return number of deleted rows
     */
    @Modifying
    @Query("DELETE FROM RefreshToken rt WHERE rt.expiresAt < :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
