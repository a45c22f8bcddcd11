package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job whose callback kind has no registered callback
 */
@Getter
public class CallbackNotFoundException extends RuntimeException {

    private final String kind;

    public CallbackNotFoundException(String kind) {
        super("No callback registered for kind: " + kind);
        this.kind = kind;
    }
}
