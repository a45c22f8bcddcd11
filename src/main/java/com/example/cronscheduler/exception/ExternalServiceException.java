package com.example.cronscheduler.exception;

import lombok.Getter;

/**
 * Exception for failures of HTTP endpoints called by callbacks
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String target;
    private final Integer httpStatusCode;
    private final String responseBody;

    public ExternalServiceException(String target, Exception cause) {
        this(target, "Call failed: " + cause.getMessage(), cause);
    }

    public ExternalServiceException(String target, String message, Exception cause) {
        super(String.format("[%s] %s", target, message), cause);
        this.target = target;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public ExternalServiceException(String target, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", target, httpStatusCode, responseBody));
        this.target = target;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }
}
