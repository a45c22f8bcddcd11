package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for task store transport or backend failures.
 * Transient: the scheduler retries on its next tick.
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Exception cause) {
        super(String.format("Task store unavailable during %s: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
