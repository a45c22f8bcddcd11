package com.example.cronscheduler.service.executor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchedulerLifecycle Tests")
class SchedulerLifecycleTest {

    @Mock
    private DistributedScheduler scheduler;

    @Test
    @DisplayName("Should start and stop the scheduler with the context")
    void shouldDelegateLifecycle() {
        var lifecycle = new SchedulerLifecycle(scheduler, true);
        when(scheduler.isRunning()).thenReturn(true);

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        lifecycle.stop();

        verify(scheduler).start();
        verify(scheduler).stop();
    }

    @Test
    @DisplayName("Should honour the auto-start flag and stop late")
    void shouldHonourAutoStart() {
        assertThat(new SchedulerLifecycle(scheduler, false).isAutoStartup()).isFalse();
        assertThat(new SchedulerLifecycle(scheduler, true).getPhase()).isGreaterThan(0);
    }
}
