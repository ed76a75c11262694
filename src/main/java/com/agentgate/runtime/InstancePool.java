package com.agentgate.runtime;

import com.agentgate.core.logging.MdcContext;
import com.agentgate.core.metrics.GatewayMetrics;
import com.agentgate.workspace.WorkspaceBuilder;
import com.agentgate.workspace.WorkspaceConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Owns the runtime instances, one per {@link PoolKey}.
 *
 * <p>Lifecycle per key:
 * <ul>
 *   <li>The first {@link #acquire} builds the workspace, allocates a port and launches the
 *       runtime. Concurrent first acquires for the same key wait on the same start.</li>
 *   <li>Later acquires re-sync agents into the live workspace and reuse the instance.</li>
 *   <li>Every acquire or {@link #touch} re-arms the idle deadline; a periodic sweep evicts
 *       keys whose deadline has passed.</li>
 *   <li>Eviction stops the runtime and removes its workspace. A replacement for the same key
 *       waits for that to finish, since every incarnation of a key shares one directory.</li>
 * </ul>
 *
 * <p>Registration, deadline updates and the idle check for a key all happen inside
 * {@code instances.compute*} calls, so an acquire and a sweep never both win the same instance.
 *
 * <p>All timestamps come from the injected {@link Clock}.
 */
@Service
public class InstancePool {

    private static final Logger log = LoggerFactory.getLogger(InstancePool.class);

    private final WorkspaceBuilder workspaceBuilder;
    private final PortAllocator portAllocator;
    private final RuntimeLauncher launcher;
    private final RuntimeProperties properties;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metrics;
    private final Clock clock;

    private final Map<PoolKey, PooledInstance> instances = new ConcurrentHashMap<>();
    private final Map<PoolKey, CompletableFuture<PooledInstance>> starting = new ConcurrentHashMap<>();
    private final Map<PoolKey, Instant> deadlines = new ConcurrentHashMap<>();
    private final Map<PoolKey, CompletableFuture<Void>> stopping = new ConcurrentHashMap<>();

    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "instance-pool-sweeper");
        t.setDaemon(true);
        return t;
    });

    public InstancePool(WorkspaceBuilder workspaceBuilder, PortAllocator portAllocator,
                        RuntimeLauncher launcher, RuntimeProperties properties,
                        ObjectMapper objectMapper, GatewayMetrics metrics, Clock clock) {
        this.workspaceBuilder = workspaceBuilder;
        this.portAllocator = portAllocator;
        this.launcher = launcher;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void startSweeper() {
        long intervalMs = properties.getSweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Instance pool sweeper started (idleTimeout={}ms, interval={}ms)",
                properties.getIdleTimeout().toMillis(), intervalMs);
    }

    @PreDestroy
    void shutdown() {
        sweeper.shutdownNow();
        int evicted = evictAll();
        log.info("Instance pool shut down ({} instances stopped)", evicted);
    }

    /**
     * Returns the live instance for the tenant's tool set, starting one if needed.
     *
     * @throws PortExhaustedException   when no port could be allocated
     * @throws RuntimeStartupException  when the runtime failed to start
     * @throws UncheckedIOException     when the workspace could not be written
     */
    public PooledInstance acquire(String tenantId, WorkspaceConfig config) {
        PoolKey key = PoolKey.of(tenantId, config.tools(), objectMapper);
        MdcContext.setInstance(key.toString());

        for (;;) {
            PooledInstance existing = instances.get(key);
            if (existing != null) {
                if (touch(existing)) {
                    return reuse(existing, config);
                }
                // Evicted between the lookup and the touch
                continue;
            }

            var created = new CompletableFuture<PooledInstance>();
            CompletableFuture<PooledInstance> inFlight = starting.putIfAbsent(key, created);
            if (inFlight != null) {
                log.debug("Waiting for in-flight start of {}", key);
                PooledInstance started = await(inFlight);
                if (touch(started)) {
                    return reuse(started, config);
                }
                continue;
            }

            try {
                // A start may have completed between the lookup and claiming the slot
                existing = instances.get(key);
                if (existing != null) {
                    created.complete(existing);
                    continue;
                }
                PooledInstance instance = start(key, config);
                instances.put(key, instance);
                touch(instance);
                created.complete(instance);
                return instance;
            } catch (RuntimeException e) {
                created.completeExceptionally(e);
                throw e;
            } finally {
                starting.remove(key, created);
            }
        }
    }

    /**
     * Marks the instance as used now and pushes its idle deadline out by the idle timeout.
     * Unknown keys are ignored.
     */
    public void touch(PoolKey key) {
        PooledInstance instance = instances.get(key);
        if (instance != null) {
            touch(instance);
        }
    }

    /**
     * Stops and removes whatever instance is registered under {@code key}.
     *
     * @return true if an instance was evicted
     */
    public boolean evict(PoolKey key, EvictionReason reason) {
        return evictIf(key, reason, current -> true);
    }

    /**
     * Evicts {@code instance} only if it is still the one registered for its key, so a
     * failed request cannot take down a replacement started in the meantime.
     */
    public boolean evict(PooledInstance instance, EvictionReason reason) {
        return evictIf(instance.key(), reason, current -> current == instance);
    }

    /**
     * Evicts every instance belonging to the tenant.
     *
     * @return number of instances evicted
     */
    public int evictTenant(String tenantId) {
        int count = 0;
        for (PoolKey key : new ArrayList<>(instances.keySet())) {
            if (key.tenantId().equals(tenantId) && evict(key, EvictionReason.TENANT)) {
                count++;
            }
        }
        if (count > 0) {
            log.info("Evicted {} instance(s) for tenant {}", count, tenantId);
        }
        return count;
    }

    public int evictAll() {
        int count = 0;
        for (PoolKey key : new ArrayList<>(instances.keySet())) {
            if (evict(key, EvictionReason.SHUTDOWN)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Evicts every instance whose idle deadline is at or before now.
     *
     * @return number of instances evicted
     */
    public int sweepIdle() {
        Instant now = clock.instant();
        int count = 0;
        for (PoolKey key : new ArrayList<>(deadlines.keySet())) {
            if (evictIf(key, EvictionReason.IDLE, current -> isExpired(key, now))) {
                count++;
            }
        }
        return count;
    }

    public List<InstanceInfo> snapshot() {
        return instances.values().stream()
                .sorted(Comparator.comparing(i -> i.key().toString()))
                .map(i -> new InstanceInfo(
                        i.key().toString(),
                        i.key().tenantId(),
                        i.port(),
                        i.workspace().toString(),
                        i.handle().isAlive(),
                        i.startedAt(),
                        i.lastUsed(),
                        deadlines.get(i.key())))
                .toList();
    }

    public int size() {
        return instances.size();
    }

    private PooledInstance reuse(PooledInstance instance, WorkspaceConfig config) {
        workspaceBuilder.syncAgents(instance.workspace(), config.agents());
        metrics.recordInstanceReused();
        log.debug("Reusing instance {} on port {}", instance.key(), instance.port());
        return instance;
    }

    private PooledInstance start(PoolKey key, WorkspaceConfig config) {
        Path directory = properties.getInstancesDir().resolve(key.directoryName());
        awaitStopped(key);
        long startMs = clock.millis();

        // Leftovers from a previous process are not trusted
        workspaceBuilder.destroy(directory);

        RuntimeHandle handle;
        try {
            workspaceBuilder.create(directory, config);
            int port = portAllocator.findAvailablePort(properties.getMaxPortAttempts());
            handle = launcher.launch(new RuntimeLaunchRequest(
                    key, directory, properties.getHostname(), port,
                    workspaceBuilder.buildEnvironment(config.secrets())));
        } catch (RuntimeException e) {
            log.error("Failed to start instance {}: {}", key, e.getMessage());
            removeWorkspace(directory);
            throw e;
        }

        long elapsedMs = clock.millis() - startMs;
        metrics.recordInstanceStarted(elapsedMs);
        log.info("Started instance {} on port {} in {}ms", key, handle.port(), elapsedMs);
        return new PooledInstance(key, handle, directory, clock.instant());
    }

    /**
     * Re-arms the deadline of {@code instance} if it is still registered.
     *
     * @return false when the instance was evicted in the meantime
     */
    private boolean touch(PooledInstance instance) {
        Instant now = clock.instant();
        PooledInstance current = instances.computeIfPresent(instance.key(), (key, registered) -> {
            if (registered == instance) {
                registered.markUsed(now);
                deadlines.put(key, now.plus(properties.getIdleTimeout()));
            }
            return registered;
        });
        return current == instance;
    }

    private boolean isExpired(PoolKey key, Instant now) {
        Instant deadline = deadlines.get(key);
        if (deadline == null || deadline.isAfter(now)) {
            return false;
        }
        log.info("Instance {} idle since {}, evicting", key, deadline.minus(properties.getIdleTimeout()));
        return true;
    }

    private boolean evictIf(PoolKey key, EvictionReason reason, Predicate<PooledInstance> condition) {
        var removed = new AtomicReference<PooledInstance>();
        var stopped = new CompletableFuture<Void>();
        instances.computeIfPresent(key, (k, current) -> {
            if (!condition.test(current)) {
                return current;
            }
            deadlines.remove(k);
            stopping.put(k, stopped);
            removed.set(current);
            return null;
        });
        PooledInstance instance = removed.get();
        if (instance == null) {
            return false;
        }
        try {
            teardown(instance, reason);
        } finally {
            stopped.complete(null);
            stopping.remove(key, stopped);
        }
        return true;
    }

    private void teardown(PooledInstance instance, EvictionReason reason) {
        try {
            instance.handle().close();
        } catch (RuntimeException e) {
            log.warn("Failed to stop instance {}: {}", instance.key(), e.getMessage());
        }
        removeWorkspace(instance.workspace());
        metrics.recordInstanceEvicted(reason.tag());
        log.info("Evicted instance {} on port {} ({})", instance.key(), instance.port(), reason.tag());
    }

    private void awaitStopped(PoolKey key) {
        CompletableFuture<Void> stopped = stopping.get(key);
        if (stopped != null) {
            log.debug("Waiting for previous instance of {} to stop", key);
            stopped.join();
        }
    }

    private void removeWorkspace(Path directory) {
        try {
            workspaceBuilder.destroy(directory);
        } catch (UncheckedIOException e) {
            log.warn("Failed to remove workspace {}: {}", directory, e.getMessage());
        }
    }

    private void sweepQuietly() {
        try {
            sweepIdle();
        } catch (RuntimeException e) {
            log.error("Idle sweep failed", e);
        }
    }

    private static PooledInstance await(CompletableFuture<PooledInstance> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new RuntimeStartupException("Instance start failed", e.getCause());
        }
    }
}
