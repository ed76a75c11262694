package com.agentgate.core.error;

import org.springframework.http.HttpStatus;

/**
 * Base for every failure the gateway renders as an OpenAI error envelope.
 * Carries the HTTP status and the OpenAI {@code error.type} it maps to.
 */
public class GatewayException extends RuntimeException {

    private final HttpStatus status;
    private final String errorType;

    public GatewayException(String message, HttpStatus status, String errorType) {
        super(message);
        this.status = status;
        this.errorType = errorType;
    }

    public GatewayException(String message, HttpStatus status, String errorType, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorType = errorType;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorType() {
        return errorType;
    }
}
