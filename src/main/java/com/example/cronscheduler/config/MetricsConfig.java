package com.example.cronscheduler.config;

import com.example.cronscheduler.service.executor.JobExecutor;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for monitoring scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Runs by callback kind and outcome
 * - Execution times
 * - Lease contention and takeovers
 * - Executor slot usage
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String PREFIX = "cron_scheduler_";

    private final MeterRegistry meterRegistry;

    /**
     * Register gauges that read the executor's slot usage
     */
    public void registerExecutorGauges(JobExecutor executor) {
        Gauge.builder(PREFIX + "executor_running", executor, JobExecutor::getRunningCount)
                .description("Callbacks currently running on this instance")
                .register(meterRegistry);

        Gauge.builder(PREFIX + "executor_free_slots", executor, JobExecutor::getFreeSlots)
                .description("Free executor slots on this instance")
                .register(meterRegistry);
    }

    /**
     * Create a timer for a callback execution
     */
    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record callback execution time
     */
    public void recordExecution(Timer.Sample sample, String kind, boolean success) {
        sample.stop(Timer.builder(PREFIX + "execution_time")
                .tag("kind", kind)
                .tag("success", String.valueOf(success))
                .description("Job callback execution time")
                .register(meterRegistry));
    }

    /**
     * Count a finished run
     */
    public void recordRun(String kind, boolean success) {
        meterRegistry.counter(PREFIX + "runs",
                "kind", kind,
                "outcome", success ? "success" : "failure"
        ).increment();
    }

    public void recordLockContended() {
        incrementCounter("lock_contended");
    }

    public void recordLeaseTakeover() {
        incrementCounter("lease_takeovers");
    }

    public void recordTickSkipped() {
        incrementCounter("ticks_skipped");
    }

    public void recordAutoDisabled(String kind) {
        incrementCounter("jobs_auto_disabled", "kind", kind);
    }

    /**
     * Increment a scheduler counter
     */
    public void incrementCounter(String name, String... tags) {
        meterRegistry.counter(PREFIX + name, tags).increment();
    }
}
