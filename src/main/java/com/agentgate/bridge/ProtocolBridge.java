package com.agentgate.bridge;

import com.agentgate.core.logging.MdcContext;
import com.agentgate.core.model.ChatMessage;
import com.agentgate.core.model.ExecutorResult;
import com.agentgate.core.model.ModelSelection;
import com.agentgate.core.model.StreamChunk;
import com.agentgate.core.model.ToolCallRecord;
import com.agentgate.runtime.EventSubscription;
import com.agentgate.runtime.EvictionReason;
import com.agentgate.runtime.InstancePool;
import com.agentgate.runtime.PooledInstance;
import com.agentgate.runtime.RuntimeClient;
import com.agentgate.runtime.RuntimeCommunicationException;
import com.agentgate.runtime.RuntimeEvent;
import com.agentgate.runtime.RuntimeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Drives one request through a pooled runtime instance.
 *
 * <p>Flow: push credentials -> create session -> subscribe to events -> send prompt ->
 * consume events until the session goes idle or errors -> delete session.
 *
 * <p>Any failure after credentials were pushed recycles the whole instance, since the
 * runtime's state can no longer be trusted. The session is deleted on every path.
 */
@Service
public class ProtocolBridge {

    private static final Logger log = LoggerFactory.getLogger(ProtocolBridge.class);

    static final String SESSION_TITLE = "AgentGate Request";
    static final String NO_RESPONSE = "No response generated";
    static final ModelSelection DEFAULT_MODEL = ModelSelection.of("anthropic", "claude-sonnet-4-20250514");

    private final InstancePool pool;
    private final RuntimeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProtocolBridge(InstancePool pool, RuntimeProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.pool = pool;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs the conversation to completion and returns the accumulated result.
     *
     * @param model       provider/model selection, or null for the default model
     * @param credentials provider id to API key, pushed before the session opens
     */
    public ExecutorResult run(PooledInstance instance, List<ChatMessage> messages,
                              ModelSelection model, Map<String, String> credentials) {
        var text = new StringBuilder();
        var toolCalls = new ArrayList<ToolCallRecord>();
        execute(instance, messages, model, credentials, new FragmentListener() {
            @Override
            public void onText(String delta) {
                text.append(delta);
            }

            @Override
            public void onToolCall(ToolCallRecord toolCall) {
                toolCalls.add(toolCall);
            }
        });
        String content = text.length() > 0 ? text.toString() : NO_RESPONSE;
        log.info("Response on {}: {} chars, {} tool call(s)", instance.key(), content.length(), toolCalls.size());
        return new ExecutorResult(content, toolCalls);
    }

    /**
     * Runs the conversation and pushes chunks into {@code sink} as events arrive. On
     * success the last chunk is {@link StreamChunk#done()}; on failure the exception
     * propagates and no done chunk is sent. The sink must not throw.
     */
    public void stream(PooledInstance instance, List<ChatMessage> messages, ModelSelection model,
                       Map<String, String> credentials, Consumer<StreamChunk> sink) {
        var sawText = new boolean[1];
        execute(instance, messages, model, credentials, new FragmentListener() {
            @Override
            public void onText(String delta) {
                sawText[0] = true;
                sink.accept(StreamChunk.text(delta));
            }

            @Override
            public void onToolCall(ToolCallRecord toolCall) {
                sink.accept(StreamChunk.toolCall(toolCall));
            }
        });
        if (!sawText[0]) {
            sink.accept(StreamChunk.text(NO_RESPONSE));
        }
        sink.accept(StreamChunk.done());
    }

    /**
     * Renders the conversation as the single text prompt the runtime takes:
     * one {@code Role: content} block per message, separated by a blank line.
     */
    static String buildPrompt(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> capitalize(m.role()) + ": " + (m.content() == null ? "" : m.content()))
                .collect(Collectors.joining("\n\n"));
    }

    private void execute(PooledInstance instance, List<ChatMessage> messages, ModelSelection model,
                         Map<String, String> credentials, FragmentListener listener) {
        RuntimeClient client = instance.client();
        ModelSelection selection = model != null ? model : DEFAULT_MODEL;

        pushCredentials(client, credentials, instance.workspace());
        String prompt = buildPrompt(messages);
        log.info("Executing {} on {}", selection.qualifiedName(), instance.key());

        try {
            String sessionId = openSession(client);
            MdcContext.setSession(sessionId);
            try (EventSubscription events = client.subscribe()) {
                client.sendPrompt(sessionId, selection, prompt);
                consume(events, sessionId, listener);
            } finally {
                deleteSession(client, sessionId);
                MdcContext.clearSession();
            }
            pool.touch(instance.key());
        } catch (RuntimeException e) {
            log.warn("Error for {}, shutting down instance: {}", instance.key(), e.getMessage());
            pool.evict(instance, EvictionReason.ERROR);
            throw e;
        }
    }

    private void pushCredentials(RuntimeClient client, Map<String, String> credentials, Path workspace) {
        if (credentials == null) {
            return;
        }
        credentials.forEach((providerId, apiKey) -> {
            try {
                client.setProviderAuth(providerId, apiKey, workspace);
            } catch (RuntimeException e) {
                log.warn("Failed to set credentials for {}: {}", providerId, e.getMessage());
            }
        });
    }

    private String openSession(RuntimeClient client) {
        try {
            return client.createSession(SESSION_TITLE);
        } catch (RuntimeCommunicationException e) {
            throw new SessionCreateFailedException(e.getMessage(), e);
        }
    }

    private void consume(EventSubscription events, String sessionId, FragmentListener listener) {
        Duration timeout = properties.getResponseTimeout();
        Instant deadline = clock.instant().plus(timeout);
        Set<String> recordedParts = new HashSet<>();

        while (true) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new ResponseTimeoutException(timeout);
            }
            Optional<RuntimeEvent> next = events.next(remaining);
            if (next.isEmpty()) {
                throw new ResponseTimeoutException(timeout);
            }

            RuntimeEvent event = next.get();
            switch (event.type()) {
                case "message.part.updated" -> handlePart(event, sessionId, recordedParts, listener);
                case "session.idle" -> {
                    if (event.isFor(sessionId)) {
                        return;
                    }
                }
                case "session.error" -> {
                    if (event.isFor(sessionId)) {
                        throw new UpstreamSessionException(
                                SessionErrorParser.parse(event.properties().path("error")));
                    }
                }
                default -> log.trace("Ignoring event {}", event.type());
            }
        }
    }

    private void handlePart(RuntimeEvent event, String sessionId, Set<String> recordedParts,
                            FragmentListener listener) {
        String partSession = event.sessionId();
        if (partSession != null && !partSession.equals(sessionId)) {
            return;
        }

        JsonNode part = event.properties().path("part");
        switch (part.path("type").asText("")) {
            case "text" -> {
                String delta = event.properties().path("delta").asText("");
                if (!delta.isEmpty()) {
                    listener.onText(delta);
                }
            }
            case "tool" -> toolCall(part).ifPresent(toolCall -> {
                String partId = part.path("id").asText(null);
                if (partId == null || recordedParts.add(partId)) {
                    log.debug("Tool call {} completed", toolCall.name());
                    listener.onToolCall(toolCall);
                }
            });
            default -> { }
        }
    }

    /**
     * A tool part counts once its state reports {@code completed}. Older runtimes send the
     * state as a bare string and only ever for finished calls.
     */
    private Optional<ToolCallRecord> toolCall(JsonNode part) {
        String name = part.path("tool").asText("");
        if (name.isEmpty()) {
            return Optional.empty();
        }
        JsonNode state = part.path("state");
        boolean completed = state.isTextual() || "completed".equals(state.path("status").asText());
        if (!completed) {
            return Optional.empty();
        }

        JsonNode input;
        if (state.has("input")) {
            input = state.get("input");
        } else if (part.has("metadata")) {
            input = part.get("metadata");
        } else {
            input = objectMapper.createObjectNode();
        }
        JsonNode output = state.has("output") ? state.get("output") : state;
        return Optional.of(new ToolCallRecord(name,
                objectMapper.convertValue(input, Object.class),
                objectMapper.convertValue(output, Object.class)));
    }

    private static void deleteSession(RuntimeClient client, String sessionId) {
        try {
            client.deleteSession(sessionId);
        } catch (RuntimeException e) {
            log.debug("Failed to delete session {}: {}", sessionId, e.getMessage());
        }
    }

    private static String capitalize(String role) {
        if (role == null || role.isEmpty()) {
            return "";
        }
        return Character.toUpperCase(role.charAt(0)) + role.substring(1);
    }

    private interface FragmentListener {
        void onText(String delta);

        void onToolCall(ToolCallRecord toolCall);
    }
}
