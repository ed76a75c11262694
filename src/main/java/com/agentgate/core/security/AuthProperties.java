package com.agentgate.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agentgate.auth")
public class AuthProperties {

    private boolean enabled = true;

    /** Bearer tokens accepted on {@code /v1/admin/**}. Bound from a comma-separated list. */
    private List<String> adminTokens = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getAdminTokens() {
        return adminTokens;
    }

    public void setAdminTokens(List<String> adminTokens) {
        this.adminTokens = adminTokens;
    }
}
