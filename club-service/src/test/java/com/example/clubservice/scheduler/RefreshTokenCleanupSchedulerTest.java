package com.example.clubservice.scheduler;

import com.example.clubservice.service.RefreshTokenService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshTokenCleanupSchedulerTest {

    @Mock
    private RefreshTokenService refreshTokenService;

    @InjectMocks
    private RefreshTokenCleanupScheduler scheduler;

    @Test
    void purgesExpiredTokensOncePerRun() {
        when(refreshTokenService.purgeExpired()).thenReturn(3);

        scheduler.purgeExpiredTokens();

        verify(refreshTokenService, times(1)).purgeExpired();
        verifyNoMoreInteractions(refreshTokenService);
    }
}
