package com.agentgate.core.tenant;

import com.agentgate.core.model.ModelSelection;
import com.agentgate.workspace.AgentDefinition;
import com.agentgate.workspace.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TenantStoreTest {

    @TempDir
    Path dataDir;

    private TenantStore store;

    @BeforeEach
    void setUp() {
        var properties = new TenantProperties();
        properties.setDataDir(dataDir.toString());
        store = new TenantStore(new ObjectMapper(), properties);
    }

    private static TenantConfig tenant(String id) {
        var providers = new LinkedHashMap<String, ProviderConfig>();
        providers.put("openrouter", new ProviderConfig("sk-or"));
        providers.put("anthropic", new ProviderConfig(""));
        return new TenantConfig(id, "Acme", List.of("ocs_" + id + "_abc"), providers,
                ModelSelection.of("openrouter", "openai/gpt-4o-mini"), Map.of("DB_URL", "postgres://"),
                "2026-01-01T00:00:00Z", "2026-01-01T00:00:00Z");
    }

    @Test
    void savedTenantCanBeFound() {
        store.save(tenant("acme"));

        TenantConfig found = store.findTenant("acme").orElseThrow();

        assertEquals("Acme", found.name());
        assertEquals(List.of("ocs_acme_abc"), found.tokens());
        assertEquals(List.of("openrouter", "anthropic"), List.copyOf(found.providers().keySet()));
        assertEquals("openai/gpt-4o-mini", found.defaultModel().modelId());
        assertEquals("postgres://", found.secrets().get("DB_URL"));
    }

    @Test
    void missingTenantIsAbsent() {
        assertTrue(store.findTenant("nobody").isEmpty());
    }

    @Test
    void unsafeIdIsAbsent() {
        assertTrue(store.findTenant("../etc").isEmpty());
        assertTrue(store.findTenant(null).isEmpty());
    }

    @Test
    void corruptRecordIsAbsent() throws IOException {
        Files.createDirectories(dataDir.resolve("tenants"));
        Files.writeString(dataDir.resolve("tenants/broken.json"), "{not json");

        assertTrue(store.findTenant("broken").isEmpty());
    }

    @Test
    void unknownFieldsAreIgnored() throws IOException {
        Files.createDirectories(dataDir.resolve("tenants"));
        Files.writeString(dataDir.resolve("tenants/legacy.json"),
                "{\"id\":\"legacy\",\"name\":\"Legacy\",\"tokens\":[],\"providers\":{},\"plan\":\"gold\"}");

        TenantConfig found = store.findTenant("legacy").orElseThrow();

        assertEquals("Legacy", found.name());
        assertTrue(found.secrets().isEmpty());
        assertNull(found.defaultModel());
    }

    @Test
    void toolsAndAgentsAreLoadedSortedByName() {
        store.saveTool("acme", new ToolDefinition("zeta", "z"));
        store.saveTool("acme", new ToolDefinition("alpha", "a"));
        store.saveAgent("acme", new AgentDefinition("reviewer", "# Reviewer"));

        List<ToolDefinition> tools = store.loadTools("acme");

        assertEquals(List.of("alpha", "zeta"), tools.stream().map(ToolDefinition::name).toList());
        assertEquals("a", tools.get(0).source());
        assertEquals(List.of(new AgentDefinition("reviewer", "# Reviewer")), store.loadAgents("acme"));
    }

    @Test
    void tenantWithoutToolsHasEmptyLists() {
        assertTrue(store.loadTools("acme").isEmpty());
        assertTrue(store.loadAgents("acme").isEmpty());
    }

    @Test
    void providerCredentialsSkipBlankKeys() {
        assertEquals(Map.of("openrouter", "sk-or"), tenant("acme").providerCredentials());
    }
}
