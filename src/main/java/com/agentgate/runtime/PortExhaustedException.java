package com.agentgate.runtime;

import com.agentgate.core.error.GatewayException;
import org.springframework.http.HttpStatus;

/**
 * Thrown when no free loopback port was found within the allowed number of probes.
 */
public class PortExhaustedException extends GatewayException {

    public PortExhaustedException(int attempts) {
        super("Could not find available port after " + attempts + " attempts",
                HttpStatus.INTERNAL_SERVER_ERROR, "server_error");
    }
}
