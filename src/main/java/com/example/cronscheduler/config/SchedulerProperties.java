package com.example.cronscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the cron scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cron-scheduler")
public class SchedulerProperties {

    /**
     * Delay between the end of one tick and the start of the next
     */
    @NotNull
    private Duration tickInterval = Duration.ofSeconds(1);

    /**
     * Maximum number of due jobs fetched per tick
     */
    @Min(1)
    private int batchSize = 10;

    /**
     * Callbacks allowed to run at the same time on this instance
     */
    @Min(1)
    private int maxConcurrent = 5;

    /**
     * How long a job lease lives before another instance may take it over
     */
    @NotNull
    private Duration leaseTtl = Duration.ofSeconds(300);

    /**
     * Consecutive failures after which a job is disabled
     */
    @Min(1)
    private int failureThreshold = 3;

    /**
     * Upper bound on waiting for in-flight runs when stopping
     */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Zone in which cron expressions are evaluated
     */
    @NotBlank
    private String timeZone = "Asia/Shanghai";

    /**
     * Start ticking with the application context
     */
    private boolean autoStart = true;

    /**
     * Lease owner token; generated from host name and a random UUID when empty
     */
    private String instanceId;

    @Valid
    private Store store = new Store();

    @Data
    public static class Store {

        /**
         * {@code jpa} (PostgreSQL) or {@code memory}
         */
        @NotBlank
        private String type = "jpa";

        /**
         * Key prefix used by the in-memory store
         */
        private String keyPrefix = "scheduler:";

        /**
         * Job records expire this long after their last write
         */
        @NotNull
        private Duration recordTtl = Duration.ofDays(30);

        /**
         * Run history entries kept per job by the in-memory store
         */
        @Min(1)
        private int runHistoryLimit = 50;

        /**
         * How often expired records, leases and old run history are purged
         */
        @NotNull
        private Duration housekeepingInterval = Duration.ofHours(1);
    }
}
