package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for a malformed or never-firing cron expression
 */
@Getter
public class InvalidCronExpressionException extends RuntimeException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason));
        this.expression = expression;
    }
}
