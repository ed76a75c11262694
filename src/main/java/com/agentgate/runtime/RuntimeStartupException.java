package com.agentgate.runtime;

import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a runtime process fails to start or does not report readiness in time.
 */
public class RuntimeStartupException extends GatewayException {

    public RuntimeStartupException(String message) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "server_error");
    }

    public RuntimeStartupException(String message, Throwable cause) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "server_error", cause);
    }
}
