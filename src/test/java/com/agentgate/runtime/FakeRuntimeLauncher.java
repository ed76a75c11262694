package com.agentgate.runtime;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.Mockito.mock;

/**
 * In-memory launcher: every launch yields a handle backed by a Mockito {@link RuntimeClient}.
 */
public class FakeRuntimeLauncher implements RuntimeLauncher {

    private final List<RuntimeLaunchRequest> requests = new CopyOnWriteArrayList<>();
    private final List<FakeHandle> handles = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile long launchDelayMs;

    @Override
    public RuntimeHandle launch(RuntimeLaunchRequest request) {
        requests.add(request);
        if (launchDelayMs > 0) {
            try {
                Thread.sleep(launchDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new RuntimeStartupException("Timeout waiting for server to start after 30000ms");
        }
        var handle = new FakeHandle(request.port(), mock(RuntimeClient.class));
        handles.add(handle);
        return handle;
    }

    public void failNext(int count) {
        failuresLeft.set(count);
    }

    public void setLaunchDelayMs(long launchDelayMs) {
        this.launchDelayMs = launchDelayMs;
    }

    public List<RuntimeLaunchRequest> requests() {
        return requests;
    }

    public List<FakeHandle> handles() {
        return handles;
    }

    public static class FakeHandle implements RuntimeHandle {

        private final int port;
        private final RuntimeClient client;
        private final CountDownLatch closeStarted = new CountDownLatch(1);
        private volatile boolean alive = true;
        private volatile CountDownLatch closeGate;

        public FakeHandle(int port, RuntimeClient client) {
            this.port = port;
            this.client = client;
        }

        @Override
        public int port() {
            return port;
        }

        @Override
        public String baseUrl() {
            return "http://127.0.0.1:" + port;
        }

        @Override
        public RuntimeClient client() {
            return client;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public void close() {
            closeStarted.countDown();
            CountDownLatch gate = closeGate;
            if (gate != null) {
                try {
                    gate.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            alive = false;
        }

        /** Makes {@link #close()} hang until {@code gate} opens, like a runtime slow to exit. */
        public void blockCloseUntil(CountDownLatch gate) {
            this.closeGate = gate;
        }

        public boolean awaitCloseStarted(long timeout, TimeUnit unit) throws InterruptedException {
            return closeStarted.await(timeout, unit);
        }
    }
}
