package com.agentgate.runtime;

/**
 * Starts runtime servers. The process-based implementation is the production one;
 * tests substitute an in-memory launcher.
 */
public interface RuntimeLauncher {

    /**
     * Starts a server and blocks until it accepts requests.
     *
     * @throws RuntimeStartupException when the server cannot be started or is not
     *                                 ready within the startup timeout
     */
    RuntimeHandle launch(RuntimeLaunchRequest request);
}
