package com.agentgate.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Reads a {@code text/event-stream} body on a background task and queues the decoded
 * events. Consecutive {@code data:} lines are joined with a newline and a blank line
 * terminates the event. Frames that are not JSON are skipped.
 */
class SseEventSubscription implements EventSubscription {

    private static final Logger log = LoggerFactory.getLogger(SseEventSubscription.class);

    private static final RuntimeEvent END_OF_STREAM = new RuntimeEvent("", null);

    private final InputStream body;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<RuntimeEvent> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;
    private volatile boolean ended;

    SseEventSubscription(InputStream body, ObjectMapper objectMapper, Executor executor) {
        this.body = body;
        this.objectMapper = objectMapper;
        executor.execute(this::readLoop);
    }

    @Override
    public Optional<RuntimeEvent> next(Duration timeout) {
        if (ended) {
            throw new RuntimeCommunicationException("Event stream closed", -1);
        }
        try {
            long nanos = Math.max(0, timeout.toNanos());
            RuntimeEvent event = queue.poll(nanos, TimeUnit.NANOSECONDS);
            if (event == null) {
                return Optional.empty();
            }
            if (event == END_OF_STREAM) {
                ended = true;
                throw new RuntimeCommunicationException("Event stream closed", -1);
            }
            return Optional.of(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeCommunicationException("Interrupted while waiting for runtime event", e);
        }
    }

    @Override
    public void close() {
        closed = true;
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Error closing event stream: {}", e.getMessage());
        }
    }

    private void readLoop() {
        try (var reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            StringBuilder data = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    dispatch(data);
                    data.setLength(0);
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(line.substring(5).stripLeading());
                }
            }
            dispatch(data);
        } catch (IOException e) {
            if (!closed) {
                log.warn("Runtime event stream failed: {}", e.getMessage());
            }
        } finally {
            queue.add(END_OF_STREAM);
        }
    }

    private void dispatch(CharSequence data) {
        if (data.length() == 0) {
            return;
        }
        try {
            JsonNode node = objectMapper.readTree(data.toString());
            queue.add(new RuntimeEvent(node.path("type").asText(""), node.get("properties")));
        } catch (IOException e) {
            log.debug("Skipping malformed runtime event: {}", data);
        }
    }
}
