package com.agentgate.core.tenant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Credentials for one model provider configured on a tenant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(String apiKey) {}
