package com.agentgate.dispatch.api;

import com.agentgate.core.model.ModelSelection;
import com.agentgate.core.tenant.TenantConfig;

/**
 * Parses the {@code model} field of a completion request. Accepted forms:
 * <ul>
 *   <li>{@code provider/model}, where the model may itself contain slashes</li>
 *   <li>{@code provider/model@agent}</li>
 *   <li>{@code model}, resolved against the tenant's default provider, else its first
 *       configured provider</li>
 *   <li>{@code model@agent}</li>
 * </ul>
 */
public final class ModelStringParser {

    private ModelStringParser() {}

    public static ModelSelection parse(String model, TenantConfig tenant) {
        String modelPart = model;
        String agentId = null;

        int at = model.lastIndexOf('@');
        if (at >= 0) {
            modelPart = model.substring(0, at);
            String agent = model.substring(at + 1);
            agentId = agent.isEmpty() ? null : agent;
        }

        int slash = modelPart.indexOf('/');
        if (slash >= 0) {
            return new ModelSelection(modelPart.substring(0, slash), modelPart.substring(slash + 1), agentId);
        }

        if (tenant.defaultModel() != null) {
            return new ModelSelection(tenant.defaultModel().providerId(), modelPart, agentId);
        }
        String firstProvider = tenant.providers().keySet().stream().findFirst().orElse("");
        return new ModelSelection(firstProvider, modelPart, agentId);
    }
}
