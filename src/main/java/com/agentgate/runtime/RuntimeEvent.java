package com.agentgate.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * One decoded frame of a runtime's {@code /event} stream.
 *
 * @param type       event type, e.g. {@code message.part.updated} or {@code session.idle}
 * @param properties event payload, never null
 */
public record RuntimeEvent(String type, JsonNode properties) {

    public RuntimeEvent {
        properties = properties == null ? MissingNode.getInstance() : properties;
    }

    /**
     * Session this event belongs to. Session-level events carry it at
     * {@code properties.sessionID}, part updates at {@code properties.part.sessionID}.
     *
     * @return the session id, or null when the event names none
     */
    public String sessionId() {
        JsonNode direct = properties.path("sessionID");
        if (direct.isTextual()) {
            return direct.asText();
        }
        JsonNode viaPart = properties.path("part").path("sessionID");
        return viaPart.isTextual() ? viaPart.asText() : null;
    }

    public boolean isFor(String sessionId) {
        return sessionId != null && sessionId.equals(sessionId());
    }
}
