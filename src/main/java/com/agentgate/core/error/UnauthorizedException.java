package com.agentgate.core.error;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends GatewayException {

    public UnauthorizedException(String message) {
        super(message, HttpStatus.UNAUTHORIZED, "authentication_error");
    }
}
