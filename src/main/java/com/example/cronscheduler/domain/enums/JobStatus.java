package com.example.cronscheduler.domain.enums;

/**
 * Outcome of the most recent run attempt of a job.
 */
public enum JobStatus {

    /**
     * Job has never run.
     */
    PENDING,

    /**
     * An attempt is in flight on some instance.
     */
    RUNNING,

    SUCCESS,

    FAILED
}
