package com.agentgate.dispatch.api;

import com.agentgate.core.llm.ModelCatalog;
import com.agentgate.core.security.AuthProperties;
import com.agentgate.core.tenant.ProviderConfig;
import com.agentgate.core.tenant.TenantConfig;
import com.agentgate.core.tenant.TenantStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelsController.class)
class ModelsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TenantStore tenantStore;

    @MockitoBean
    private AuthProperties authProperties;

    @MockitoBean
    private Clock clock;

    @BeforeEach
    void setUp() {
        var providers = new LinkedHashMap<String, ProviderConfig>();
        providers.put("openrouter", new ProviderConfig("sk-or"));
        providers.put("anthropic", new ProviderConfig("sk-ant"));
        var tenant = new TenantConfig("acme", "Acme", List.of("ocs_acme_s3cret"), providers, null, Map.of(), null, null);
        when(tenantStore.findTenant("acme")).thenReturn(Optional.of(tenant));
        when(authProperties.isEnabled()).thenReturn(true);
        when(clock.millis()).thenReturn(1_767_225_600_000L);
    }

    @Test
    void listsCatalogModelsOfConfiguredProviders() throws Exception {
        mockMvc.perform(get("/v1/models").header("Authorization", "Bearer ocs_acme_s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.object").value("list"))
                .andExpect(jsonPath("$.data", hasSize(ModelCatalog.ANTHROPIC_MODELS.size())))
                .andExpect(jsonPath("$.data[0].id").value("anthropic/claude-sonnet-4-20250514"))
                .andExpect(jsonPath("$.data[0].object").value("model"))
                .andExpect(jsonPath("$.data[0].created").value(1767225600))
                .andExpect(jsonPath("$.data[*].owned_by", everyItem(is("anthropic"))));
    }

    @Test
    void requiresToken() throws Exception {
        mockMvc.perform(get("/v1/models"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.type").value("authentication_error"));
    }
}
