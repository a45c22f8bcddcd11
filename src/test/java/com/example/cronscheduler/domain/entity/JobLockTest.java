package com.example.cronscheduler.domain.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobLock Entity Tests")
class JobLockTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should key leases by job id")
    void shouldKeyByJobId() {
        assertThat(JobLock.keyFor("abc")).isEqualTo("lock:abc");
    }

    @Test
    @DisplayName("Should expire at its expiry instant")
    void shouldExpire() {
        var lock = JobLock.builder().lockKey("lock:a").owner("node-1").acquiredAt(NOW).expiresAt(NOW.plusSeconds(60)).build();

        assertThat(lock.isExpired(NOW.plusSeconds(59))).isFalse();
        assertThat(lock.isExpired(NOW.plusSeconds(60))).isTrue();
        assertThat(lock.isHeldBy("node-1")).isTrue();
        assertThat(lock.isHeldBy("node-2")).isFalse();
    }
}
