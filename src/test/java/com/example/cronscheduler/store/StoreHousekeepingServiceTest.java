package com.example.cronscheduler.store;

import com.example.cronscheduler.exception.StoreUnavailableException;
import com.example.cronscheduler.service.alert.SlackAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StoreHousekeepingService Tests")
class StoreHousekeepingServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private TaskStore taskStore;

    @Mock
    private SlackAlertService slackAlertService;

    private StoreHousekeepingService housekeepingService;

    @BeforeEach
    void setUp() {
        housekeepingService = new StoreHousekeepingService(taskStore, slackAlertService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should purge with the current time")
    void shouldPurge() {
        when(taskStore.purgeExpired(NOW)).thenReturn(3);

        housekeepingService.purgeExpired();

        verify(taskStore).purgeExpired(NOW);
        verify(slackAlertService, never()).sendErrorAlert(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should alert instead of failing when the store is down")
    void shouldAlertOnFailure() {
        when(taskStore.purgeExpired(NOW))
                .thenThrow(new StoreUnavailableException("purgeExpired", new IllegalStateException("connection refused")));

        housekeepingService.purgeExpired();

        verify(slackAlertService).sendErrorAlert(eq("Cron scheduler housekeeping failed"), anyString(), anyString());
    }
}
