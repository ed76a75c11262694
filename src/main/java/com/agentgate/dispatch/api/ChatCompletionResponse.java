package com.agentgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatCompletionResponse(
    String id,
    String object,
    long created,
    String model,
    List<Choice> choices,
    Usage usage
) {

    public static final String OBJECT = "chat.completion";

    public record Choice(
        int index,
        Message message,
        @JsonProperty("finish_reason") String finishReason
    ) {}

    /** {@code content} is serialized even when null, as OpenAI clients expect it. */
    public record Message(
        String role,
        String content,
        @JsonProperty("tool_calls") @JsonInclude(JsonInclude.Include.NON_NULL) List<ToolCall> toolCalls
    ) {}

    public record ToolCall(String id, String type, FunctionCall function) {}

    public record FunctionCall(String name, String arguments) {}

    public record Usage(
        @JsonProperty("prompt_tokens") int promptTokens,
        @JsonProperty("completion_tokens") int completionTokens,
        @JsonProperty("total_tokens") int totalTokens
    ) {
        public static final Usage EMPTY = new Usage(0, 0, 0);
    }
}
