package com.agentgate.workspace;

/**
 * A tenant tool, materialized as {@code .opencode/tool/<name>.ts}.
 *
 * @param name   file stem, also the name the runtime exposes the tool under
 * @param source TypeScript source of the tool
 */
public record ToolDefinition(String name, String source) {}
