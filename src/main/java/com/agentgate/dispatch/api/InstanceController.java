package com.agentgate.dispatch.api;

import com.agentgate.runtime.InstanceInfo;
import com.agentgate.runtime.InstancePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin view of the instance pool. Guarded by the admin token check in
 * {@link com.agentgate.core.security.TenantAuthFilter}.
 */
@RestController
@RequestMapping("/v1/admin/instances")
public class InstanceController {

    private static final Logger log = LoggerFactory.getLogger(InstanceController.class);

    private final InstancePool pool;

    public InstanceController(InstancePool pool) {
        this.pool = pool;
    }

    @GetMapping
    public Map<String, Object> listInstances() {
        List<InstanceInfo> instances = pool.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", instances);
        return body;
    }

    /**
     * DELETE /v1/admin/instances/{tenantId}: stops every instance of the tenant, e.g.
     * after its tools or secrets changed.
     */
    @DeleteMapping("/{tenantId}")
    public Map<String, Object> evictTenant(@PathVariable String tenantId) {
        int evicted = pool.evictTenant(tenantId);
        log.info("Admin eviction for tenant {}: {} instance(s)", tenantId, evicted);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("evicted", evicted);
        return body;
    }
}
