package com.agentgate.workspace;

import com.agentgate.core.model.ModelSelection;
import com.agentgate.core.tenant.ProviderConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to materialize a tenant workspace.
 *
 * @param tenantId     owning tenant
 * @param sessionId    durable session id; a workspace generated for it survives cleanup
 * @param providers    configured providers keyed by id
 * @param defaultModel tenant default model, may be null
 * @param requestModel model selected by the current request; overrides the default when set
 * @param tools        tools, fixed for the lifetime of an instance
 * @param agents       agents, re-synced on every request
 * @param secrets      environment variables for the runtime process
 */
public record WorkspaceConfig(
    String tenantId,
    String sessionId,
    Map<String, ProviderConfig> providers,
    ModelSelection defaultModel,
    ModelSelection requestModel,
    List<ToolDefinition> tools,
    List<AgentDefinition> agents,
    Map<String, String> secrets
) {

    public WorkspaceConfig {
        providers = providers == null ? Map.of() : new LinkedHashMap<>(providers);
        tools = tools == null ? List.of() : List.copyOf(tools);
        agents = agents == null ? List.of() : List.copyOf(agents);
        secrets = secrets == null ? Map.of() : Map.copyOf(secrets);
    }

    /** The model the runtime should default to: the request's choice, else the tenant's. */
    public ModelSelection effectiveModel() {
        return requestModel != null ? requestModel : defaultModel;
    }
}
