package com.agentgate.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs streamed completions off the request thread and writes them to an
 * {@link SseEmitter} in OpenAI's wire format: one {@code data: <json>} frame per chunk,
 * then {@code data: [DONE]}. A failure after the stream started is reported as an
 * in-band {@code data: {"error":...}} frame, after which the stream ends.
 *
 * <p>A client that disconnects stops receiving frames, but the completion itself runs
 * to its end so the runtime session is torn down normally.
 */
@Service
public class CompletionStreamingService {

    private static final Logger log = LoggerFactory.getLogger(CompletionStreamingService.class);

    /** Emitter timeout: generous, the bridge enforces its own response timeout. */
    private static final long EMITTER_TIMEOUT_MS = 10 * 60 * 1000L;

    static final String DONE_FRAME = "data: [DONE]\n\n";

    private static final MediaType FRAME_TYPE = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final ChatCompletionService completionService;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    @Autowired
    public CompletionStreamingService(ChatCompletionService completionService, ObjectMapper objectMapper) {
        this(completionService, objectMapper, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "completion-stream");
            t.setDaemon(true);
            return t;
        }));
    }

    CompletionStreamingService(ChatCompletionService completionService, ObjectMapper objectMapper, Executor executor) {
        this.completionService = completionService;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    public SseEmitter stream(String tenantId, ChatCompletionRequest request, String sessionId) {
        return stream(tenantId, request, sessionId, new SseEmitter(EMITTER_TIMEOUT_MS));
    }

    SseEmitter stream(String tenantId, ChatCompletionRequest request, String sessionId, SseEmitter emitter) {
        var open = new AtomicBoolean(true);
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> {
            log.debug("Completion stream for tenant {} timed out", tenantId);
            open.set(false);
        });
        emitter.onError(e -> open.set(false));

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        executor.execute(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                completionService.stream(tenantId, request, sessionId, chunk -> {
                    if (open.get() && !write(emitter, toJson(chunk))) {
                        open.set(false);
                    }
                });
                if (open.get()) {
                    writeRaw(emitter, DONE_FRAME);
                }
            } catch (RuntimeException e) {
                log.warn("Streamed completion for tenant {} failed: {}", tenantId, e.getMessage());
                if (open.get()) {
                    write(emitter, toJson(OpenAiErrors.envelope(e)));
                }
            } finally {
                emitter.complete();
                MDC.clear();
            }
        });
        return emitter;
    }

    private boolean write(SseEmitter emitter, String json) {
        return writeRaw(emitter, "data: " + json + "\n\n");
    }

    /**
     * Writes a pre-formatted SSE frame. {@link SseEmitter#event()} would add its own
     * {@code data:} framing around the payload, so frames go out as plain text.
     *
     * @return false once the client is gone
     */
    private boolean writeRaw(SseEmitter emitter, String frame) {
        try {
            emitter.send(Set.of(new ResponseBodyEmitter.DataWithMediaType(frame, FRAME_TYPE)));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Stopped writing completion stream (client gone): {}", e.getMessage());
            return false;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream frame", e);
        }
    }
}
