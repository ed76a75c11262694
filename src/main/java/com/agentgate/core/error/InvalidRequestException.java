package com.agentgate.core.error;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a request body fails validation. Messages use the
 * {@code field: problem} form so the offending parameter can be reported.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "invalid_request_error");
    }
}
