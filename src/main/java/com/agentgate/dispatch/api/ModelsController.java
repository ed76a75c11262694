package com.agentgate.dispatch.api;

import com.agentgate.core.error.UnauthorizedException;
import com.agentgate.core.llm.ModelCatalog;
import com.agentgate.core.security.TenantAuthFilter;
import com.agentgate.core.tenant.TenantConfig;
import com.agentgate.core.tenant.TenantStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/v1/models")
public class ModelsController {

    private final TenantStore tenantStore;
    private final Clock clock;

    public ModelsController(TenantStore tenantStore, Clock clock) {
        this.tenantStore = tenantStore;
        this.clock = clock;
    }

    /**
     * GET /v1/models: catalog models of every provider the tenant has configured,
     * in provider declaration order. A tenant that no longer exists gets an empty list.
     */
    @GetMapping
    public ModelsListResponse listModels(
            @RequestAttribute(name = TenantAuthFilter.TENANT_ATTRIBUTE, required = false) TenantConfig tenant) {
        if (tenant == null) {
            throw new UnauthorizedException("Invalid or missing token");
        }
        var current = tenantStore.findTenant(tenant.id());
        if (current.isEmpty()) {
            return ModelsListResponse.of(List.of());
        }

        long now = clock.millis() / 1000;
        var models = new ArrayList<ModelsListResponse.ModelEntry>();
        for (String providerId : current.get().providers().keySet()) {
            for (ModelCatalog.ModelInfo model : ModelCatalog.modelsFor(providerId)) {
                models.add(new ModelsListResponse.ModelEntry(model.qualifiedId(), "model", now, providerId));
            }
        }
        return ModelsListResponse.of(models);
    }
}
