package com.agentgate.runtime;

/**
 * Why an instance left the pool. The lowercase name is used as a metric tag.
 */
public enum EvictionReason {
    IDLE,
    TENANT,
    ERROR,
    SHUTDOWN;

    public String tag() {
        return name().toLowerCase();
    }
}
