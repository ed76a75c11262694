package com.agentgate.bridge;

import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

public class SessionCreateFailedException extends GatewayException {

    public SessionCreateFailedException(String detail, Throwable cause) {
        super("Failed to create session: " + detail, HttpStatus.INTERNAL_SERVER_ERROR, "server_error", cause);
    }
}
