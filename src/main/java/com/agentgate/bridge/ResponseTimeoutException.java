package com.agentgate.bridge;

import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * Thrown when a session neither finished nor failed within the response timeout.
 * The runtime is not asked to cancel; the instance is recycled instead.
 */
public class ResponseTimeoutException extends GatewayException {

    public ResponseTimeoutException(Duration timeout) {
        super("Response timeout after " + timeout.toMillis() + "ms",
                HttpStatus.INTERNAL_SERVER_ERROR, "server_error");
    }
}
