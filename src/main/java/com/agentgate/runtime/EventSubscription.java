package com.agentgate.runtime;

import java.time.Duration;
import java.util.Optional;

/**
 * An open subscription to a runtime's event stream. Events published after the
 * subscription was opened are buffered until read.
 */
public interface EventSubscription extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or empty when the timeout elapsed first
     * @throws RuntimeCommunicationException when the stream has ended
     */
    Optional<RuntimeEvent> next(Duration timeout);

    @Override
    void close();
}
