package com.agentgate.core.model;

/**
 * One element of the ordered chunk sequence a streaming request produces.
 * A sequence always ends with exactly one {@link Type#DONE} chunk when it succeeds.
 *
 * @param type     chunk kind
 * @param content  text fragment for {@link Type#TEXT}, otherwise null
 * @param toolCall completed tool call for {@link Type#TOOL_CALL}, otherwise null
 */
public record StreamChunk(Type type, String content, ToolCallRecord toolCall) {

    public enum Type { TEXT, TOOL_CALL, DONE }

    public static StreamChunk text(String content) {
        return new StreamChunk(Type.TEXT, content, null);
    }

    public static StreamChunk toolCall(ToolCallRecord toolCall) {
        return new StreamChunk(Type.TOOL_CALL, null, toolCall);
    }

    public static StreamChunk done() {
        return new StreamChunk(Type.DONE, null, null);
    }
}
