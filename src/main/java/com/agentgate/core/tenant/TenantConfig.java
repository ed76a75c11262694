package com.agentgate.core.tenant;

import com.agentgate.core.model.ModelSelection;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tenant record as persisted in {@code <dataDir>/tenants/<id>.json}.
 *
 * @param id           tenant id, also the first segment of its bearer tokens
 * @param name         display name
 * @param tokens       accepted bearer tokens ({@code ocs_<id>_<secret>})
 * @param providers    configured providers keyed by provider id, in declaration order
 * @param defaultModel model used when a request names a bare model, may be null
 * @param secrets      environment variables exported to the tenant's runtime
 * @param createdAt    ISO-8601 creation timestamp
 * @param updatedAt    ISO-8601 last update timestamp
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TenantConfig(
    String id,
    String name,
    List<String> tokens,
    Map<String, ProviderConfig> providers,
    ModelSelection defaultModel,
    Map<String, String> secrets,
    String createdAt,
    String updatedAt
) {

    public TenantConfig {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        // Provider order matters: the first one is the fallback for bare model names.
        providers = providers == null ? Map.of() : new LinkedHashMap<>(providers);
        secrets = secrets == null ? Map.of() : Map.copyOf(secrets);
    }

    /** Provider id → API key for every provider that has a key. */
    public Map<String, String> providerCredentials() {
        var credentials = new LinkedHashMap<String, String>();
        providers.forEach((providerId, config) -> {
            if (config != null && config.apiKey() != null && !config.apiKey().isBlank()) {
                credentials.put(providerId, config.apiKey());
            }
        });
        return credentials;
    }
}
