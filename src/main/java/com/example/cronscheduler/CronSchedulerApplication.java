package com.example.cronscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cron Scheduler Service Application
 * <p>
 * A distributed, lease-coordinated scheduler for recurring cron jobs.
 * <p>
 * Features:
 * - Any number of instances share one job store, no leader
 * - Per-job leases with TTL so a due job runs on one instance at a time
 * - Bounded per-instance concurrency
 * - Auto-disable with Slack alerting after repeated failures
 * - REST API for job management and cron preview
 */
@EnableScheduling
@SpringBootApplication
public class CronSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronSchedulerApplication.class, args);
    }
}
