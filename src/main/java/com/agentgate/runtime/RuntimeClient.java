package com.agentgate.runtime;

import com.agentgate.core.model.ModelSelection;

import java.nio.file.Path;

/**
 * Client for one runtime instance's loopback HTTP API.
 */
public interface RuntimeClient {

    /**
     * Opens a new session.
     *
     * @return the session id assigned by the runtime
     */
    String createSession(String title);

    /**
     * Queues a text prompt on a session. Returns once the runtime has accepted it;
     * output arrives on the event stream.
     *
     * @param model provider/model and optional agent, never null
     */
    void sendPrompt(String sessionId, ModelSelection model, String text);

    void deleteSession(String sessionId);

    /** Opens the instance-wide event stream. */
    EventSubscription subscribe();

    /**
     * Registers an API key for a provider, scoped to the given workspace directory.
     */
    void setProviderAuth(String providerId, String apiKey, Path directory);
}
