package com.agentgate.dispatch.api;

import com.agentgate.bridge.ProtocolBridge;
import com.agentgate.core.error.TenantNotFoundException;
import com.agentgate.core.metrics.GatewayMetrics;
import com.agentgate.core.model.ChatMessage;
import com.agentgate.core.model.ExecutorResult;
import com.agentgate.core.model.ModelSelection;
import com.agentgate.core.model.StreamChunk;
import com.agentgate.core.model.ToolCallRecord;
import com.agentgate.core.tenant.ProviderConfig;
import com.agentgate.core.tenant.TenantConfig;
import com.agentgate.core.tenant.TenantStore;
import com.agentgate.runtime.InstancePool;
import com.agentgate.runtime.MutableClock;
import com.agentgate.runtime.PooledInstance;
import com.agentgate.runtime.RuntimeClient;
import com.agentgate.runtime.RuntimeStartupException;
import com.agentgate.runtime.TestInstances;
import com.agentgate.workspace.AgentDefinition;
import com.agentgate.workspace.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChatCompletionServiceTest {

    private static final List<ChatMessage> MESSAGES = List.of(ChatMessage.of("user", "What's the weather?"));

    private TenantStore tenantStore;
    private InstancePool pool;
    private ProtocolBridge bridge;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private ChatCompletionService service;
    private PooledInstance instance;

    @BeforeEach
    void setUp() {
        tenantStore = mock(TenantStore.class);
        pool = mock(InstancePool.class);
        bridge = mock(ProtocolBridge.class);
        registry = new SimpleMeterRegistry();
        clock = new MutableClock();
        service = new ChatCompletionService(tenantStore, pool, bridge, new ObjectMapper(),
                new GatewayMetrics(registry), clock);

        var providers = new LinkedHashMap<String, ProviderConfig>();
        providers.put("anthropic", new ProviderConfig("sk-ant"));
        providers.put("openrouter", new ProviderConfig(null));
        var tenant = new TenantConfig("acme", "Acme", List.of("ocs_acme_secret"), providers,
                ModelSelection.of("anthropic", "claude-sonnet-4-20250514"), Map.of("FOO", "bar"), null, null);
        when(tenantStore.findTenant("acme")).thenReturn(Optional.of(tenant));
        when(tenantStore.loadTools("acme")).thenReturn(List.of(new ToolDefinition("get_weather", "export default {}")));
        when(tenantStore.loadAgents("acme")).thenReturn(List.of(new AgentDefinition("researcher", "# Researcher")));

        instance = TestInstances.instance("acme", mock(RuntimeClient.class), Path.of("/tmp/ws"), 14096);
        when(pool.acquire(eq("acme"), any())).thenReturn(instance);
    }

    private static ChatCompletionRequest request(String model) {
        return new ChatCompletionRequest(model, MESSAGES, null, null, null, null, null);
    }

    private long completions(String mode, String outcome) {
        var timer = registry.find("agentgate.completion.duration").tag("mode", mode).tag("outcome", outcome).timer();
        return timer == null ? 0 : timer.count();
    }

    @Test
    @DisplayName("context carries the parsed model, tenant workspace inputs and keyed credentials")
    void buildsContext() {
        var context = service.buildContext("acme", request("claude-sonnet@researcher"), "ses-42");

        assertEquals(new ModelSelection("anthropic", "claude-sonnet", "researcher"), context.model());
        assertEquals(Map.of("anthropic", "sk-ant"), context.credentials());
        assertEquals("ses-42", context.workspace().sessionId());
        assertEquals(context.model(), context.workspace().effectiveModel());
        assertEquals("get_weather", context.workspace().tools().get(0).name());
        assertEquals("researcher", context.workspace().agents().get(0).name());
        assertEquals(Map.of("FOO", "bar"), context.workspace().secrets());
    }

    @Test
    void unknownTenantFails() {
        assertThrows(TenantNotFoundException.class,
                () -> service.complete("ghost", request("gpt-4o"), null));
        assertEquals(1, completions("unary", "error"));
    }

    @Test
    @DisplayName("text answer becomes a stop completion")
    void textCompletion() {
        when(bridge.run(eq(instance), eq(MESSAGES), any(), anyMap()))
                .thenReturn(new ExecutorResult("Sunny in Paris.", List.of()));

        ChatCompletionResponse response = service.complete("acme", request("anthropic/claude-sonnet-4-20250514"), null);

        assertTrue(response.id().startsWith("chatcmpl-"));
        assertEquals("chat.completion", response.object());
        assertEquals("anthropic/claude-sonnet-4-20250514", response.model());
        assertEquals(clock.millis() / 1000, response.created());
        var choice = response.choices().get(0);
        assertEquals("assistant", choice.message().role());
        assertEquals("Sunny in Paris.", choice.message().content());
        assertNull(choice.message().toolCalls());
        assertEquals("stop", choice.finishReason());
        assertEquals(ChatCompletionResponse.Usage.EMPTY, response.usage());
        assertEquals(1, completions("unary", "success"));
        verify(bridge).run(instance, MESSAGES, ModelSelection.of("anthropic", "claude-sonnet-4-20250514"),
                Map.of("anthropic", "sk-ant"));
    }

    @Test
    @DisplayName("tool calls replace the content and finish with tool_calls")
    void toolCallCompletion() {
        when(bridge.run(any(), any(), any(), anyMap())).thenReturn(new ExecutorResult("No response generated",
                List.of(new ToolCallRecord("get_weather", Map.of("city", "Paris"), "sunny"))));

        var choice = service.complete("acme", request("gpt-4o"), null).choices().get(0);

        assertNull(choice.message().content());
        assertEquals("tool_calls", choice.finishReason());
        var toolCall = choice.message().toolCalls().get(0);
        assertTrue(toolCall.id().startsWith("call_"));
        assertEquals("function", toolCall.type());
        assertEquals("get_weather", toolCall.function().name());
        assertEquals("{\"city\":\"Paris\"}", toolCall.function().arguments());
    }

    @Test
    @DisplayName("stream emits role, content and stop chunks under one id")
    @SuppressWarnings("unchecked")
    void streamsChunks() {
        doAnswer(invocation -> {
            Consumer<StreamChunk> sink = invocation.getArgument(4);
            sink.accept(StreamChunk.text("He"));
            sink.accept(StreamChunk.toolCall(new ToolCallRecord("get_weather", Map.of(), "sunny")));
            sink.accept(StreamChunk.text(""));
            sink.accept(StreamChunk.text("llo"));
            sink.accept(StreamChunk.done());
            return null;
        }).when(bridge).stream(any(), any(), any(), anyMap(), any(Consumer.class));
        var chunks = new ArrayList<ChatCompletionChunk>();

        service.stream("acme", request("gpt-4o"), null, chunks::add);

        assertEquals(4, chunks.size());
        assertEquals(new ChatCompletionChunk.Delta("assistant", null), chunks.get(0).choices().get(0).delta());
        assertEquals("He", chunks.get(1).choices().get(0).delta().content());
        assertEquals("llo", chunks.get(2).choices().get(0).delta().content());
        assertEquals(ChatCompletionChunk.Delta.EMPTY, chunks.get(3).choices().get(0).delta());
        assertEquals("stop", chunks.get(3).choices().get(0).finishReason());
        assertNull(chunks.get(1).choices().get(0).finishReason());
        assertEquals(1, chunks.stream().map(ChatCompletionChunk::id).distinct().count());
        assertTrue(chunks.stream().allMatch(c -> "chat.completion.chunk".equals(c.object())));
        assertEquals(1, completions("stream", "success"));
    }

    @Test
    @DisplayName("role chunk is delivered before the instance starts")
    void streamFailureAfterRoleChunk() {
        when(pool.acquire(anyString(), any()))
                .thenThrow(new RuntimeStartupException("Timeout waiting for server to start after 30000ms"));
        var chunks = new ArrayList<ChatCompletionChunk>();

        assertThrows(RuntimeStartupException.class,
                () -> service.stream("acme", request("gpt-4o"), null, chunks::add));

        assertEquals(1, chunks.size());
        assertEquals("assistant", chunks.get(0).choices().get(0).delta().role());
        assertEquals(1, completions("stream", "error"));
    }
}
