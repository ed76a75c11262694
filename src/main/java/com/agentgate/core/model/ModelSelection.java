package com.agentgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Provider/model pair the runtime should answer with, optionally routed to a named agent.
 *
 * @param providerId runtime provider id, e.g. "anthropic" or "openrouter"
 * @param modelId    model id within that provider, may itself contain slashes
 * @param agentId    agent name, or null for the runtime's default agent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelSelection(String providerId, String modelId, String agentId) {

    public static ModelSelection of(String providerId, String modelId) {
        return new ModelSelection(providerId, modelId, null);
    }

    /** Renders the selection in the runtime's {@code provider/model} form. */
    public String qualifiedName() {
        return providerId + "/" + modelId;
    }
}
