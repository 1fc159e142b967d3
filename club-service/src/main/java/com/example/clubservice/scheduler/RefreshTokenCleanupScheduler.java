package com.example.clubservice.scheduler;

import com.example.clubservice.service.RefreshTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes expired refresh tokens, revoked or not.
 * Runs daily at 3 AM unless club.security.refresh-token-cleanup-cron says otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefreshTokenCleanupScheduler {

    private final RefreshTokenService refreshTokenService;

    @Scheduled(cron = "${club.security.refresh-token-cleanup-cron:0 0 3 * * *}")
    @SchedulerLock(name = "refreshTokenCleanup", lockAtMostFor = "30m", lockAtLeastFor = "1m")
    public void purgeExpiredTokens() {
        log.info("Starting refresh token cleanup");

        int deleted = refreshTokenService.purgeExpired();

        if (deleted > 0) {
            log.info("Deleted {} expired refresh token(s)", deleted);
        } else {
            log.info("No expired refresh tokens to clean up");
        }
    }
}
