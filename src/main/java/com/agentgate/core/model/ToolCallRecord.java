package com.agentgate.core.model;

/**
 * A tool invocation observed while the runtime worked on a prompt.
 *
 * @param name   tool name
 * @param input  tool arguments as reported by the runtime (JSON-compatible value)
 * @param output tool output, or null when the runtime did not report one
 */
public record ToolCallRecord(String name, Object input, Object output) {}
