package com.agentgate.runtime;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the instance pool. Reports each live instance and
 * whether its process is still running. An empty pool is healthy.
 */
@Component
public class RuntimePoolHealthIndicator implements HealthIndicator {

    private final InstancePool pool;

    public RuntimePoolHealthIndicator(InstancePool pool) {
        this.pool = pool;
    }

    @Override
    public Health health() {
        var instances = pool.snapshot();
        var builder = Health.up().withDetail("instances", instances.size());
        boolean anyDown = false;

        for (InstanceInfo info : instances) {
            if (info.alive()) {
                builder.withDetail(info.key(), "UP (port " + info.port() + ")");
            } else {
                builder.withDetail(info.key(), "DOWN (port " + info.port() + ")");
                anyDown = true;
            }
        }

        return anyDown ? builder.status("DEGRADED").build() : builder.build();
    }
}
