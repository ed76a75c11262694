package com.agentgate.workspace;

/**
 * A tenant agent, materialized as {@code .opencode/agent/<name>.md}.
 *
 * @param name    file stem, referenced by the {@code model@agent} syntax
 * @param content markdown agent definition
 */
public record AgentDefinition(String name, String content) {}
