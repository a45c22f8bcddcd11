package com.example.cronscheduler.service;

import com.example.cronscheduler.cron.CronEvaluator;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.exception.InvalidCronExpressionException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.exception.JobVersionConflictException;
import com.example.cronscheduler.service.executor.DispatchOutcome;
import com.example.cronscheduler.service.executor.DistributedScheduler;
import com.example.cronscheduler.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobManagementService Tests")
class JobManagementServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:30Z");

    @Mock
    private TaskStore taskStore;

    @Mock
    private DistributedScheduler scheduler;

    @Captor
    private ArgumentCaptor<ScheduledJob> jobCaptor;

    private JobManagementService jobManagementService;

    private ScheduledJob existingJob;

    @BeforeEach
    void setUp() {
        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        lenient().when(taskStore.update(any(), any())).thenCallRealMethod();
        jobManagementService = new JobManagementService(taskStore, new CronEvaluator(ZoneOffset.UTC), scheduler, clock);

        existingJob = ScheduledJob.builder()
                .id("job-1")
                .name("nightly-report")
                .cronExpression("0 2 * * *")
                .callbackConfig(new HashMap<>(Map.of("kind", "report")))
                .nextRun(Instant.parse("2024-01-02T02:00:00Z"))
                .failureCount(2)
                .createdAt(NOW.minusSeconds(3600))
                .build();
    }

    @Nested
    @DisplayName("Job Creation Tests")
    class JobCreationTests {

        @Test
        @DisplayName("Should create job with computed next run")
        void shouldCreateJob() {
            // When
            var jobId = jobManagementService.addJob("every-five", "*/5 * * * *", Map.of("kind", "report"), true);

            // Then
            verify(taskStore).put(jobCaptor.capture());
            var saved = jobCaptor.getValue();
            assertThat(saved.getId()).isEqualTo(jobId);
            assertThat(saved.getName()).isEqualTo("every-five");
            assertThat(saved.getNextRun()).isEqualTo(Instant.parse("2024-01-01T10:05:00Z"));
            assertThat(saved.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(saved.isEnabled()).isTrue();
            assertThat(saved.getRunCount()).isZero();
            assertThat(saved.getCallbackKind()).isEqualTo("report");
        }

        @Test
        @DisplayName("Should give every job a distinct id")
        void shouldGiveDistinctIds() {
            var first = jobManagementService.addJob("a", "* * * * *", Map.of(), true);
            var second = jobManagementService.addJob("a", "* * * * *", Map.of(), true);

            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("Should reject an invalid cron expression without storing")
        void shouldRejectInvalidCron() {
            assertThatThrownBy(() -> jobManagementService.addJob("bad", "61 * * * *", Map.of(), true))
                    .isInstanceOf(InvalidCronExpressionException.class);

            verify(taskStore, never()).put(any());
        }

        @Test
        @DisplayName("Should reject a cron expression that never fires")
        void shouldRejectNeverFiringCron() {
            assertThatThrownBy(() -> jobManagementService.addJob("feb-31", "0 0 31 2 *", Map.of(), true))
                    .isInstanceOf(InvalidCronExpressionException.class)
                    .hasMessageContaining("never fires");
        }

        @Test
        @DisplayName("Should require a name")
        void shouldRequireName() {
            assertThatThrownBy(() -> jobManagementService.addJob(" ", "* * * * *", Map.of(), true))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Job Update Tests")
    class JobUpdateTests {

        @Test
        @DisplayName("Should recompute next run when the cron changes")
        void shouldRescheduleOnCronChange() {
            when(taskStore.get("job-1")).thenReturn(Optional.of(existingJob));

            var updated = jobManagementService.updateJob("job-1", null, "30 10 * * *", null, null);

            assertThat(updated.getCronExpression()).isEqualTo("30 10 * * *");
            assertThat(updated.getNextRun()).isEqualTo(Instant.parse("2024-01-01T10:30:00Z"));
            verify(taskStore).put(updated);
        }

        @Test
        @DisplayName("Should keep next run when only the name changes")
        void shouldKeepNextRunOnRename() {
            when(taskStore.get("job-1")).thenReturn(Optional.of(existingJob));

            var updated = jobManagementService.updateJob("job-1", "renamed", null, null, null);

            assertThat(updated.getName()).isEqualTo("renamed");
            assertThat(updated.getNextRun()).isEqualTo(Instant.parse("2024-01-02T02:00:00Z"));
        }

        @Test
        @DisplayName("Should replace the callback config")
        void shouldReplaceCallbackConfig() {
            when(taskStore.get("job-1")).thenReturn(Optional.of(existingJob));

            var updated = jobManagementService.updateJob("job-1", null, null, Map.of("kind", "other"), null);

            assertThat(updated.getCallbackKind()).isEqualTo("other");
        }

        @Test
        @DisplayName("Should reapply only its own fields after a concurrent write")
        void shouldReapplyAfterConflict() {
            // Given
            var afterRun = existingJob.copy();
            afterRun.setRunCount(1);
            afterRun.setStatus(JobStatus.SUCCESS);
            afterRun.setNextRun(Instant.parse("2024-01-03T02:00:00Z"));
            when(taskStore.get("job-1"))
                    .thenReturn(Optional.of(existingJob.copy()))
                    .thenReturn(Optional.of(afterRun));
            doThrow(new JobVersionConflictException("job-1")).doNothing().when(taskStore).put(any());

            // When
            var updated = jobManagementService.updateJob("job-1", "renamed", null, null, null);

            // Then
            verify(taskStore, times(2)).put(any());
            assertThat(updated.getName()).isEqualTo("renamed");
            assertThat(updated.getRunCount()).isEqualTo(1);
            assertThat(updated.getStatus()).isEqualTo(JobStatus.SUCCESS);
            assertThat(updated.getNextRun()).isEqualTo(Instant.parse("2024-01-03T02:00:00Z"));
        }

        @Test
        @DisplayName("Should give up after repeated conflicts")
        void shouldGiveUpAfterRepeatedConflicts() {
            when(taskStore.get("job-1")).thenAnswer(invocation -> Optional.of(existingJob.copy()));
            doThrow(new JobVersionConflictException("job-1")).when(taskStore).put(any());

            assertThatThrownBy(() -> jobManagementService.disableJob("job-1"))
                    .isInstanceOf(JobVersionConflictException.class);
            verify(taskStore, times(TaskStore.MAX_UPDATE_ATTEMPTS)).put(any());
        }

        @Test
        @DisplayName("Should throw when the job does not exist")
        void shouldThrowWhenMissing() {
            when(taskStore.get("missing")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> jobManagementService.updateJob("missing", "x", null, null, null))
                    .isInstanceOf(JobNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Enable and Disable Tests")
    class EnableDisableTests {

        @Test
        @DisplayName("Should disable a job and keep its next run")
        void shouldDisableJob() {
            when(taskStore.get("job-1")).thenReturn(Optional.of(existingJob));

            var disabled = jobManagementService.disableJob("job-1");

            assertThat(disabled.isEnabled()).isFalse();
            assertThat(disabled.getNextRun()).isEqualTo(Instant.parse("2024-01-02T02:00:00Z"));
            verify(taskStore).put(disabled);
        }

        @Test
        @DisplayName("Should re-enable a job, resetting failures and rescheduling from now")
        void shouldReEnableJob() {
            existingJob.setEnabled(false);
            existingJob.setNextRun(Instant.parse("2023-12-01T02:00:00Z"));
            when(taskStore.get("job-1")).thenAnswer(invocation -> Optional.of(existingJob.copy()));

            var enabled = jobManagementService.enableJob("job-1");

            assertThat(enabled.isEnabled()).isTrue();
            assertThat(enabled.getFailureCount()).isZero();
            assertThat(enabled.getNextRun()).isEqualTo(Instant.parse("2024-01-02T02:00:00Z"));
        }

        @Test
        @DisplayName("Should not write when enabling an enabled job")
        void shouldBeIdempotent() {
            when(taskStore.get("job-1")).thenReturn(Optional.of(existingJob));

            jobManagementService.enableJob("job-1");

            verify(taskStore, never()).put(any());
        }
    }

    @Nested
    @DisplayName("Removal and Retrieval Tests")
    class RetrievalTests {

        @Test
        @DisplayName("Should remove an existing job")
        void shouldRemoveJob() {
            when(taskStore.delete("job-1")).thenReturn(true);

            jobManagementService.removeJob("job-1");

            verify(taskStore).delete("job-1");
        }

        @Test
        @DisplayName("Should throw when removing an unknown job")
        void shouldThrowWhenRemovingUnknownJob() {
            when(taskStore.delete("missing")).thenReturn(false);

            assertThatThrownBy(() -> jobManagementService.removeJob("missing"))
                    .isInstanceOf(JobNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Should return run history of an existing job")
        void shouldReturnRunHistory() {
            var run = JobRun.builder().jobId("job-1").attemptNumber(1L).status(JobStatus.SUCCESS).build();
            when(taskStore.get("job-1")).thenReturn(Optional.of(existingJob));
            when(taskStore.listRuns("job-1", 20)).thenReturn(List.of(run));

            assertThat(jobManagementService.getRunHistory("job-1", 20)).containsExactly(run);
        }

        @Test
        @DisplayName("Should reject a non-positive history limit")
        void shouldRejectNonPositiveLimit() {
            assertThatThrownBy(() -> jobManagementService.getRunHistory("job-1", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should delegate manual triggers to the scheduler")
        void shouldDelegateTrigger() {
            when(scheduler.triggerNow("job-1")).thenReturn(DispatchOutcome.DISPATCHED);

            assertThat(jobManagementService.triggerJob("job-1")).isEqualTo(DispatchOutcome.DISPATCHED);
        }
    }

    @Nested
    @DisplayName("Cron Tool Tests")
    class CronToolTests {

        @Test
        @DisplayName("Should preview fire times from now")
        void shouldPreviewFromNow() {
            assertThat(jobManagementService.previewCron("0 * * * *", 3)).containsExactly(
                    Instant.parse("2024-01-01T11:00:00Z"),
                    Instant.parse("2024-01-01T12:00:00Z"),
                    Instant.parse("2024-01-01T13:00:00Z"));
        }

        @Test
        @DisplayName("Should bound the preview count")
        void shouldBoundPreviewCount() {
            assertThatThrownBy(() -> jobManagementService.previewCron("* * * * *", 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> jobManagementService.previewCron("* * * * *", JobManagementService.MAX_PREVIEW + 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should describe with upcoming runs")
        void shouldDescribeWithUpcomingRuns() {
            var description = jobManagementService.describeCron("0 9 * * *");

            assertThat(description.getDescription()).isEqualTo("At 09:00");
            assertThat(description.getNextRuns()).hasSize(5)
                    .first().isEqualTo(Instant.parse("2024-01-02T09:00:00Z"));
        }
    }
}
