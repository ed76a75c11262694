package com.agentgate.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One {@code chat.completion.chunk} frame of a streamed completion.
 */
public record ChatCompletionChunk(
    String id,
    String object,
    long created,
    String model,
    List<Choice> choices
) {

    public static final String OBJECT = "chat.completion.chunk";

    public record Choice(
        int index,
        Delta delta,
        @JsonProperty("finish_reason") String finishReason
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(String role, String content) {

        public static final Delta EMPTY = new Delta(null, null);
    }

    static ChatCompletionChunk of(String id, long created, String model, Delta delta, String finishReason) {
        return new ChatCompletionChunk(id, OBJECT, created, model, List.of(new Choice(0, delta, finishReason)));
    }
}
