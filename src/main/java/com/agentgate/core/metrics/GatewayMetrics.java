package com.agentgate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the runtime pool and completion traffic.
 */
@Service
public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordInstanceStarted(long startupMs) {
        Timer.builder("agentgate.instance.startup")
                .description("Time to launch a runtime instance until it accepts requests")
                .register(registry)
                .record(Duration.ofMillis(startupMs));
    }

    /**
     * @param reason "idle", "tenant", "error" or "shutdown"
     */
    public void recordInstanceEvicted(String reason) {
        Counter.builder("agentgate.instance.evictions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordInstanceReused() {
        Counter.builder("agentgate.instance.reuses")
                .register(registry)
                .increment();
    }

    /**
     * @param mode    "unary" or "stream"
     * @param outcome "success" or "error"
     */
    public void recordCompletion(String mode, String outcome, long ms) {
        Timer.builder("agentgate.completion.duration")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
