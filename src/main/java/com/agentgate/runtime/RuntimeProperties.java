package com.agentgate.runtime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentgate")
public class RuntimeProperties {

    private Runtime runtime = new Runtime();
    private Pool pool = new Pool();

    // -- Runtime accessors (delegate to nested) --
    public String getCommand() { return runtime.command; }
    public String getHostname() { return runtime.hostname; }
    public Duration getStartupTimeout() { return Duration.ofSeconds(runtime.startupTimeoutSeconds); }
    public Duration getResponseTimeout() { return Duration.ofMillis(runtime.responseTimeoutMs); }

    // -- Pool accessors (delegate to nested) --
    public Duration getIdleTimeout() { return Duration.ofMillis(pool.idleTimeoutMs); }
    public Duration getSweepInterval() { return Duration.ofMillis(pool.sweepIntervalMs); }
    public int getPortRangeStart() { return pool.portRangeStart; }
    public int getPortRangeEnd() { return pool.portRangeEnd; }
    public int getMaxPortAttempts() { return pool.maxPortAttempts; }

    /**
     * Root for everything the pool writes: {@code instances/} for pooled workspaces and
     * {@code workspaces/} for standalone ones. Defaults to {@code <tmpdir>/opencode-service}.
     */
    public Path getBaseDir() {
        if (pool.baseDir != null && !pool.baseDir.isBlank()) {
            return Path.of(pool.baseDir);
        }
        return Path.of(System.getProperty("java.io.tmpdir"), "opencode-service");
    }

    public Path getInstancesDir() {
        return getBaseDir().resolve("instances");
    }

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }

    public static class Runtime {
        private String command = "opencode";
        private String hostname = "127.0.0.1";
        private int startupTimeoutSeconds = 30;
        private long responseTimeoutMs = 30_000;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getHostname() { return hostname; }
        public void setHostname(String hostname) { this.hostname = hostname; }
        public int getStartupTimeoutSeconds() { return startupTimeoutSeconds; }
        public void setStartupTimeoutSeconds(int startupTimeoutSeconds) { this.startupTimeoutSeconds = startupTimeoutSeconds; }
        public long getResponseTimeoutMs() { return responseTimeoutMs; }
        public void setResponseTimeoutMs(long responseTimeoutMs) { this.responseTimeoutMs = responseTimeoutMs; }
    }

    public static class Pool {
        private long idleTimeoutMs = 300_000;
        private long sweepIntervalMs = 5_000;
        private int portRangeStart = 14096;
        private int portRangeEnd = 15000;
        private int maxPortAttempts = 20;
        private String baseDir = "";

        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
        public int getPortRangeStart() { return portRangeStart; }
        public void setPortRangeStart(int portRangeStart) { this.portRangeStart = portRangeStart; }
        public int getPortRangeEnd() { return portRangeEnd; }
        public void setPortRangeEnd(int portRangeEnd) { this.portRangeEnd = portRangeEnd; }
        public int getMaxPortAttempts() { return maxPortAttempts; }
        public void setMaxPortAttempts(int maxPortAttempts) { this.maxPortAttempts = maxPortAttempts; }
        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
    }
}
