package com.agentgate.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Hands out loopback ports for new runtime instances.
 *
 * <p>Candidates come from a counter that wraps over the configured range. Each candidate
 * is bound and immediately released; the first one that binds wins. The port is not held
 * afterwards, so another process may take it before the runtime binds it. A runtime that
 * then fails to start is recycled by the pool rather than retried here.
 */
@Component
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    private final String hostname;
    private final int rangeStart;
    private final int rangeEnd;
    private int nextPort;

    @Autowired
    public PortAllocator(RuntimeProperties properties) {
        this(properties.getHostname(), properties.getPortRangeStart(), properties.getPortRangeEnd());
    }

    PortAllocator(String hostname, int rangeStart, int rangeEnd) {
        if (rangeEnd < rangeStart) {
            throw new IllegalArgumentException("Port range end " + rangeEnd + " is below start " + rangeStart);
        }
        this.hostname = hostname;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.nextPort = rangeStart;
    }

    /**
     * @param maxAttempts number of candidates to probe before giving up
     * @return a port that was bindable at probe time
     * @throws PortExhaustedException when every probed candidate was taken
     */
    public int findAvailablePort(int maxAttempts) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int port = nextCandidate();
            if (isPortAvailable(port)) {
                return port;
            }
            log.debug("Port {} in use, trying next...", port);
        }
        throw new PortExhaustedException(maxAttempts);
    }

    private synchronized int nextCandidate() {
        int port = nextPort++;
        if (nextPort > rangeEnd) {
            nextPort = rangeStart;
        }
        return port;
    }

    boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getByName(hostname), port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
