package com.agentgate.runtime;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A live runtime owned by {@link InstancePool}. Callers may use the client for the
 * duration of a request but never close the handle themselves.
 */
public final class PooledInstance {

    private final PoolKey key;
    private final RuntimeHandle handle;
    private final Path workspace;
    private final Instant startedAt;
    private volatile Instant lastUsed;

    PooledInstance(PoolKey key, RuntimeHandle handle, Path workspace, Instant startedAt) {
        this.key = key;
        this.handle = handle;
        this.workspace = workspace;
        this.startedAt = startedAt;
        this.lastUsed = startedAt;
    }

    public PoolKey key() { return key; }
    public int port() { return handle.port(); }
    public Path workspace() { return workspace; }
    public Instant startedAt() { return startedAt; }
    public Instant lastUsed() { return lastUsed; }
    public RuntimeClient client() { return handle.client(); }

    RuntimeHandle handle() {
        return handle;
    }

    void markUsed(Instant now) {
        this.lastUsed = now;
    }
}
