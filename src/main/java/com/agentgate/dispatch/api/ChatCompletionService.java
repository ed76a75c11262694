package com.agentgate.dispatch.api;

import com.agentgate.bridge.ProtocolBridge;
import com.agentgate.core.error.TenantNotFoundException;
import com.agentgate.core.metrics.GatewayMetrics;
import com.agentgate.core.model.ExecutorResult;
import com.agentgate.core.model.ModelSelection;
import com.agentgate.core.model.StreamChunk;
import com.agentgate.core.model.ToolCallRecord;
import com.agentgate.core.tenant.TenantConfig;
import com.agentgate.core.tenant.TenantStore;
import com.agentgate.runtime.InstancePool;
import com.agentgate.runtime.PooledInstance;
import com.agentgate.workspace.WorkspaceConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Translates OpenAI chat completion requests into pool/bridge calls and renders the
 * results as OpenAI completions or chunk sequences.
 */
@Service
public class ChatCompletionService {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionService.class);

    private final TenantStore tenantStore;
    private final InstancePool pool;
    private final ProtocolBridge bridge;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metrics;
    private final Clock clock;

    public ChatCompletionService(TenantStore tenantStore, InstancePool pool, ProtocolBridge bridge,
                                 ObjectMapper objectMapper, GatewayMetrics metrics, Clock clock) {
        this.tenantStore = tenantStore;
        this.pool = pool;
        this.bridge = bridge;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Everything a request needs besides the messages.
     *
     * @param model       parsed request model
     * @param workspace   workspace the instance is keyed and built from
     * @param credentials provider id to API key
     */
    record RequestContext(ModelSelection model, WorkspaceConfig workspace, Map<String, String> credentials) {}

    RequestContext buildContext(String tenantId, ChatCompletionRequest request, String sessionId) {
        TenantConfig tenant = tenantStore.findTenant(tenantId)
                .orElseThrow(() -> new TenantNotFoundException(tenantId));

        ModelSelection model = ModelStringParser.parse(request.model(), tenant);
        var workspace = new WorkspaceConfig(
                tenantId,
                sessionId,
                tenant.providers(),
                tenant.defaultModel(),
                model,
                tenantStore.loadTools(tenantId),
                tenantStore.loadAgents(tenantId),
                tenant.secrets());
        return new RequestContext(model, workspace, tenant.providerCredentials());
    }

    public ChatCompletionResponse complete(String tenantId, ChatCompletionRequest request, String sessionId) {
        long startMs = clock.millis();
        String outcome = "error";
        try {
            RequestContext context = buildContext(tenantId, request, sessionId);
            PooledInstance instance = pool.acquire(tenantId, context.workspace());
            ExecutorResult result = bridge.run(instance, request.messages(), context.model(), context.credentials());
            outcome = "success";
            return toResponse(request.model(), result);
        } finally {
            metrics.recordCompletion("unary", outcome, clock.millis() - startMs);
        }
    }

    /**
     * Streams a completion as chunks: a role chunk, one content chunk per text fragment
     * and a final stop chunk. The caller writes the {@code [DONE]} terminator. On failure
     * the exception propagates after whatever chunks were already delivered.
     */
    public void stream(String tenantId, ChatCompletionRequest request, String sessionId,
                       Consumer<ChatCompletionChunk> sink) {
        long startMs = clock.millis();
        String outcome = "error";
        try {
            RequestContext context = buildContext(tenantId, request, sessionId);
            String id = completionId();
            long created = epochSeconds();
            String model = request.model();

            sink.accept(ChatCompletionChunk.of(id, created, model, new ChatCompletionChunk.Delta("assistant", null), null));

            PooledInstance instance = pool.acquire(tenantId, context.workspace());
            bridge.stream(instance, request.messages(), context.model(), context.credentials(), chunk -> {
                switch (chunk.type()) {
                    case TEXT -> {
                        if (chunk.content() != null && !chunk.content().isEmpty()) {
                            sink.accept(ChatCompletionChunk.of(id, created, model,
                                    new ChatCompletionChunk.Delta(null, chunk.content()), null));
                        }
                    }
                    case TOOL_CALL -> log.debug("Tool call {} not forwarded to stream", chunk.toolCall().name());
                    case DONE -> sink.accept(ChatCompletionChunk.of(id, created, model,
                            ChatCompletionChunk.Delta.EMPTY, "stop"));
                }
            });
            outcome = "success";
        } finally {
            metrics.recordCompletion("stream", outcome, clock.millis() - startMs);
        }
    }

    ChatCompletionResponse toResponse(String model, ExecutorResult result) {
        ChatCompletionResponse.Message message;
        String finishReason;
        if (result.hasToolCalls()) {
            List<ChatCompletionResponse.ToolCall> toolCalls = result.toolCalls().stream()
                    .map(this::toToolCall)
                    .toList();
            message = new ChatCompletionResponse.Message("assistant", null, toolCalls);
            finishReason = "tool_calls";
        } else {
            message = new ChatCompletionResponse.Message("assistant", result.content(), null);
            finishReason = "stop";
        }
        return new ChatCompletionResponse(
                completionId(),
                ChatCompletionResponse.OBJECT,
                epochSeconds(),
                model,
                List.of(new ChatCompletionResponse.Choice(0, message, finishReason)),
                ChatCompletionResponse.Usage.EMPTY);
    }

    private ChatCompletionResponse.ToolCall toToolCall(ToolCallRecord record) {
        String arguments;
        try {
            arguments = objectMapper.writeValueAsString(record.input());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool call input for " + record.name() + " is not serializable", e);
        }
        return new ChatCompletionResponse.ToolCall(
                "call_" + UUID.randomUUID().toString().substring(0, 8),
                "function",
                new ChatCompletionResponse.FunctionCall(record.name(), arguments));
    }

    private static String completionId() {
        return "chatcmpl-" + UUID.randomUUID();
    }

    private long epochSeconds() {
        return clock.millis() / 1000;
    }
}
