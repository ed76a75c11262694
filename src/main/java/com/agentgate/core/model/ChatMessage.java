package com.agentgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One turn of an OpenAI-style conversation.
 *
 * @param role       "system", "user", "assistant" or "tool"
 * @param content    message text, may be null for assistant tool-call turns
 * @param name       optional participant name
 * @param toolCalls  tool calls previously emitted by the assistant
 * @param toolCallId id of the tool call a "tool" message answers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
    String role,
    String content,
    String name,
    @JsonProperty("tool_calls") List<JsonNode> toolCalls,
    @JsonProperty("tool_call_id") String toolCallId
) {

    public static ChatMessage of(String role, String content) {
        return new ChatMessage(role, content, null, null, null);
    }
}
