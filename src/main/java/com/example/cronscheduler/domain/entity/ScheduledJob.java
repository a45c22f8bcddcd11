package com.example.cronscheduler.domain.entity;

import com.example.cronscheduler.domain.enums.JobStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A recurring job definition plus the bookkeeping of its last run.
 * <p>
 * The id is assigned once at creation and is the only key used for leases.
 * Fields written by the scheduler after a run: status, lastRun, nextRun,
 * runCount, failureCount, lastError, lastDurationMs and (on auto-disable) enabled.
 * Every write is checked against {@link #version}; see {@code TaskStore#update}.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
        @Index(name = "idx_job_enabled_next_run", columnList = "enabled, next_run"),
        @Index(name = "idx_job_record_expires_at", columnList = "record_expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ScheduledJob {

    public static final String KIND_KEY = "kind";
    public static final String LEGACY_KIND_KEY = "workflow";

    @Id
    @Column(name = "id", updatable = false, nullable = false, length = 64)
    private String id;

    /**
     * Null until first stored
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    /**
     * Opaque configuration handed verbatim to the callback
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "callback_config", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> callbackConfig = new HashMap<>();

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "next_run")
    private Instant nextRun;

    @Column(name = "last_run")
    private Instant lastRun;

    @Column(name = "run_count", nullable = false)
    @Builder.Default
    private long runCount = 0;

    /**
     * Consecutive failures, reset on success
     */
    @Column(name = "failure_count", nullable = false)
    @Builder.Default
    private int failureCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_duration_ms")
    private Long lastDurationMs;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    /**
     * Record is dropped by housekeeping after this instant; refreshed on every write
     */
    @Column(name = "record_expires_at")
    private Instant recordExpiresAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
        if (this.status == null) {
            this.status = JobStatus.PENDING;
        }
        if (this.callbackConfig == null) {
            this.callbackConfig = new HashMap<>();
        }
    }

    // === Helper Methods ===

    /**
     * Resolve the callback kind: {@code kind}, then legacy {@code workflow}, then the job name.
     */
    public String getCallbackKind() {
        if (callbackConfig != null) {
            var kind = callbackConfig.get(KIND_KEY);
            if (kind instanceof String s && !s.isBlank()) {
                return s;
            }
            var legacy = callbackConfig.get(LEGACY_KIND_KEY);
            if (legacy instanceof String s && !s.isBlank()) {
                return s;
            }
        }
        return name;
    }

    /**
     * Due when enabled and the next fire time is not after {@code now}
     */
    public boolean isDue(Instant now) {
        return enabled && nextRun != null && !nextRun.isAfter(now);
    }

    public boolean isRecordExpired(Instant now) {
        return recordExpiresAt != null && !recordExpiresAt.isAfter(now);
    }

    /**
     * Detached copy with its own callback config map
     */
    public ScheduledJob copy() {
        return toBuilder()
                .callbackConfig(callbackConfig == null ? new HashMap<>() : new HashMap<>(callbackConfig))
                .build();
    }
}
