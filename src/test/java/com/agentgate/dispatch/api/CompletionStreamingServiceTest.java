package com.agentgate.dispatch.api;

import com.agentgate.bridge.UpstreamSessionException;
import com.agentgate.core.model.ChatMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class CompletionStreamingServiceTest {

    private static final ChatCompletionRequest REQUEST = new ChatCompletionRequest("gpt-4o",
            List.of(ChatMessage.of("user", "Hi")), true, null, null, null, null);

    private ChatCompletionService completionService;
    private CompletionStreamingService streamingService;

    @BeforeEach
    void setUp() {
        completionService = mock(ChatCompletionService.class);
        streamingService = new CompletionStreamingService(completionService, new ObjectMapper(), Runnable::run);
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    private static ChatCompletionChunk chunk(String content) {
        return ChatCompletionChunk.of("chatcmpl-1", 1767225600L, "gpt-4o",
                new ChatCompletionChunk.Delta(null, content), null);
    }

    @SuppressWarnings("unchecked")
    private void answerWith(Consumer<Consumer<ChatCompletionChunk>> behaviour) {
        doAnswer(invocation -> {
            behaviour.accept(invocation.getArgument(3));
            return null;
        }).when(completionService).stream(eq("acme"), eq(REQUEST), isNull(), any(Consumer.class));
    }

    @Test
    void writesDataFramesThenDone() {
        answerWith(sink -> {
            sink.accept(chunk("He"));
            sink.accept(chunk("llo"));
        });
        var emitter = new CapturingEmitter(Integer.MAX_VALUE);

        streamingService.stream("acme", REQUEST, null, emitter);

        assertEquals(3, emitter.frames.size());
        assertTrue(emitter.frames.get(0).startsWith("data: {"));
        assertTrue(emitter.frames.get(0).contains("\"id\":\"chatcmpl-1\""));
        assertTrue(emitter.frames.get(0).contains("\"delta\":{\"content\":\"He\"}"));
        assertTrue(emitter.frames.get(0).endsWith("}\n\n"));
        assertEquals(CompletionStreamingService.DONE_FRAME, emitter.frames.get(2));
        assertTrue(emitter.completed);
    }

    @Test
    void failureIsReportedInBandWithoutDone() {
        answerWith(sink -> {
            sink.accept(chunk("He"));
            throw new UpstreamSessionException("[authentication_error] invalid x-api-key");
        });
        var emitter = new CapturingEmitter(Integer.MAX_VALUE);

        streamingService.stream("acme", REQUEST, null, emitter);

        assertEquals(2, emitter.frames.size());
        String errorFrame = emitter.frames.get(1);
        assertTrue(errorFrame.startsWith("data: {\"error\":{"));
        assertTrue(errorFrame.contains("\"message\":\"[authentication_error] invalid x-api-key\""));
        assertTrue(errorFrame.contains("\"type\":\"server_error\""));
        assertFalse(emitter.frames.contains(CompletionStreamingService.DONE_FRAME));
        assertTrue(emitter.completed);
    }

    @Test
    void stopsWritingOnceClientIsGone() {
        answerWith(sink -> {
            sink.accept(chunk("a"));
            sink.accept(chunk("b"));
            sink.accept(chunk("c"));
        });
        var emitter = new CapturingEmitter(1);

        streamingService.stream("acme", REQUEST, null, emitter);

        assertEquals(1, emitter.frames.size());
        assertEquals(2, emitter.attempts);
        assertTrue(emitter.completed);
    }

    @Test
    void propagatesMdcToWorker() {
        MDC.put("tenantId", "acme");
        var seen = new CopyOnWriteArrayList<String>();
        answerWith(sink -> seen.add(MDC.get("tenantId")));

        streamingService.stream("acme", REQUEST, null, new CapturingEmitter(Integer.MAX_VALUE));

        assertEquals(List.of("acme"), seen);
    }

    /** Records raw frames; fails every send after {@code capacity} frames. */
    private static class CapturingEmitter extends SseEmitter {

        private final int capacity;
        private final List<String> frames = new CopyOnWriteArrayList<>();
        private int attempts;
        private boolean completed;

        CapturingEmitter(int capacity) {
            this.capacity = capacity;
        }

        @Override
        public void send(Set<ResponseBodyEmitter.DataWithMediaType> items) throws IOException {
            attempts++;
            if (frames.size() >= capacity) {
                throw new IOException("Broken pipe");
            }
            for (ResponseBodyEmitter.DataWithMediaType item : items) {
                frames.add((String) item.getData());
            }
        }

        @Override
        public synchronized void complete() {
            completed = true;
        }
    }
}
