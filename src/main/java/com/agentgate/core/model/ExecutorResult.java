package com.agentgate.core.model;

import java.util.List;

/**
 * Outcome of one prompt driven through a runtime session.
 *
 * @param content   concatenated text deltas in arrival order
 * @param toolCalls tool calls in the order they completed
 */
public record ExecutorResult(String content, List<ToolCallRecord> toolCalls) {

    public ExecutorResult {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
