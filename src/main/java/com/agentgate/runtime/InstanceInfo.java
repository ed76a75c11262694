package com.agentgate.runtime;

import java.time.Instant;

/**
 * Read-only view of a pooled instance, as listed by {@link InstancePool#snapshot()}.
 */
public record InstanceInfo(
    String key,
    String tenantId,
    int port,
    String workspace,
    boolean alive,
    Instant startedAt,
    Instant lastUsed,
    Instant idleDeadline
) {}
