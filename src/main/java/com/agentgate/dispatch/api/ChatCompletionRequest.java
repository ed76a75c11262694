package com.agentgate.dispatch.api;

import com.agentgate.core.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /v1/chat/completions}. Sampling parameters are validated but
 * not forwarded; the runtime picks its own.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,
    Double temperature,
    @JsonProperty("top_p") Double topP,
    @JsonProperty("max_tokens") Integer maxTokens,
    String user
) {

    public boolean streaming() {
        return Boolean.TRUE.equals(stream);
    }
}
