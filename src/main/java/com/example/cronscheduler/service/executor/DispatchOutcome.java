package com.example.cronscheduler.service.executor;

/**
 * What happened to a job the scheduler tried to run
 */
public enum DispatchOutcome {

    /**
     * Handed to the executor; reconciliation follows on completion
     */
    DISPATCHED,

    /**
     * Another instance holds the lease
     */
    CONTENDED,

    /**
     * Removed, disabled, no longer due, or already running here
     */
    SKIPPED,

    /**
     * Executor was saturated; lease released and retried on a later tick
     */
    DEFERRED,

    /**
     * Recorded as a failed run without invoking anything
     */
    FAILED
}
