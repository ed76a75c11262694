package com.agentgate.bridge;

import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * A {@code session.error} reported by the runtime, typically a provider failure
 * (bad key, rate limit, unknown model). The message is already flattened by
 * {@link SessionErrorParser}.
 */
public class UpstreamSessionException extends GatewayException {

    public UpstreamSessionException(String message) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "server_error");
    }
}
