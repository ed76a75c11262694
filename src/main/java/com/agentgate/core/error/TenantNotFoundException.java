package com.agentgate.core.error;

import org.springframework.http.HttpStatus;

public class TenantNotFoundException extends GatewayException {

    public TenantNotFoundException(String tenantId) {
        super("Tenant " + tenantId + " not found", HttpStatus.NOT_FOUND, "not_found_error");
    }
}
