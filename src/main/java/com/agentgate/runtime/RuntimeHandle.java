package com.agentgate.runtime;

/**
 * A started runtime server. Closing the handle stops the server.
 */
public interface RuntimeHandle extends AutoCloseable {

    int port();

    /** Base URL the server reported as its listen address. */
    String baseUrl();

    RuntimeClient client();

    boolean isAlive();

    /** Stops the server. Idempotent. */
    @Override
    void close();
}
