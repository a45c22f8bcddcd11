package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job write based on a stale read: the record was changed or
 * removed after the writer loaded it.
 */
@Getter
public class JobVersionConflictException extends RuntimeException {

    private final String jobId;

    public JobVersionConflictException(String jobId) {
        super("Job was modified concurrently: " + jobId);
        this.jobId = jobId;
    }
}
