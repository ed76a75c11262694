package com.agentgate.runtime;

import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Thrown when a call to a runtime's HTTP API fails at the transport level or
 * returns an error status.
 */
public class RuntimeCommunicationException extends GatewayException {

    private final int statusCode;

    public RuntimeCommunicationException(String message, int statusCode) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "server_error");
        this.statusCode = statusCode;
    }

    public RuntimeCommunicationException(String message, Throwable cause) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "server_error", cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the runtime, or -1 when the call never completed. */
    public int getStatusCode() {
        return statusCode;
    }
}
