package com.agentgate.runtime;

import java.nio.file.Path;
import java.util.Map;

/**
 * Parameters for starting one runtime server.
 *
 * @param poolKey     pool key the instance will be registered under
 * @param workspace   working directory of the runtime process
 * @param hostname    loopback address to bind
 * @param port        port to bind
 * @param environment complete process environment
 */
public record RuntimeLaunchRequest(
    PoolKey poolKey,
    Path workspace,
    String hostname,
    int port,
    Map<String, String> environment
) {}
