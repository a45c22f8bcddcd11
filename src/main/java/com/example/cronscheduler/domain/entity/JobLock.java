package com.example.cronscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A lease on one job: held by {@code owner} until {@code expiresAt}.
 */
@Entity
@Table(name = "job_locks", indexes = {
        @Index(name = "idx_job_lock_expires_at", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@ToString
public class JobLock {

    public static final String KEY_PREFIX = "lock:";

    @Id
    @Column(name = "lock_key", nullable = false, length = 100)
    private String lockKey;

    @Column(name = "owner", nullable = false, length = 200)
    private String owner;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public static String keyFor(String jobId) {
        return KEY_PREFIX + jobId;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String candidate) {
        return owner.equals(candidate);
    }
}
