package com.agentgate.workspace;

import com.agentgate.core.model.ModelSelection;
import com.agentgate.core.tenant.ProviderConfig;
import com.agentgate.runtime.RuntimeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceBuilderTest {

    @TempDir
    Path baseDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WorkspaceBuilder builder;

    @BeforeEach
    void setUp() {
        var properties = new RuntimeProperties();
        properties.getPool().setBaseDir(baseDir.toString());
        builder = new WorkspaceBuilder(objectMapper, properties);
    }

    private static WorkspaceConfig config(String sessionId, ModelSelection requestModel) {
        var providers = new LinkedHashMap<String, ProviderConfig>();
        providers.put("anthropic", new ProviderConfig("sk-ant"));
        providers.put("openai", new ProviderConfig("sk-oai"));
        return new WorkspaceConfig(
                "acme",
                sessionId,
                providers,
                ModelSelection.of("anthropic", "claude-sonnet-4-20250514"),
                requestModel,
                List.of(new ToolDefinition("weather", "export default { name: 'weather' }")),
                List.of(new AgentDefinition("reviewer", "# Reviewer")),
                Map.of());
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("writes tools, agents and opencode.json")
        void writesLayout() throws IOException {
            Path dir = builder.create(baseDir.resolve("ws"), config(null, null));

            assertEquals("export default { name: 'weather' }",
                    Files.readString(dir.resolve(".opencode/tool/weather.ts")));
            assertEquals("# Reviewer", Files.readString(dir.resolve(".opencode/agent/reviewer.md")));

            JsonNode json = objectMapper.readTree(dir.resolve("opencode.json").toFile());
            assertEquals("https://opencode.ai/config.json", json.get("$schema").asText());
            assertTrue(json.get("provider").has("anthropic"));
            assertTrue(json.get("provider").has("openai"));
            assertEquals("anthropic/claude-sonnet-4-20250514", json.get("model").asText());
        }

        @Test
        @DisplayName("API keys are not written to disk")
        void keysStayOutOfConfig() throws IOException {
            Path dir = builder.create(baseDir.resolve("ws"), config(null, null));

            String json = Files.readString(dir.resolve("opencode.json"));
            assertFalse(json.contains("sk-ant"));
            assertFalse(json.contains("sk-oai"));
        }

        @Test
        @DisplayName("request model overrides the tenant default")
        void requestModelWins() throws IOException {
            Path dir = builder.create(baseDir.resolve("ws"),
                    config(null, ModelSelection.of("openai", "gpt-4o-mini")));

            JsonNode json = objectMapper.readTree(dir.resolve("opencode.json").toFile());
            assertEquals("openai/gpt-4o-mini", json.get("model").asText());
        }

        @Test
        @DisplayName("model is omitted when neither default nor request model is set")
        void noModel() {
            var bare = new WorkspaceConfig("acme", null, Map.of(), null, null, List.of(), List.of(), Map.of());

            var json = builder.runtimeConfig(bare);

            assertFalse(json.has("model"));
            assertFalse(json.has("provider"));
        }

        @Test
        @DisplayName("rejects names that would escape the workspace")
        void rejectsUnsafeNames() {
            var evil = new WorkspaceConfig("acme", null, Map.of(), null, null,
                    List.of(new ToolDefinition("../escape", "")), List.of(), Map.of());

            assertThrows(IllegalArgumentException.class, () -> builder.create(baseDir.resolve("ws"), evil));
        }
    }

    @Test
    @DisplayName("syncAgents replaces the agent set and leaves tools alone")
    void syncAgentsReplacesAgents() throws IOException {
        Path dir = builder.create(baseDir.resolve("ws"), config(null, null));

        builder.syncAgents(dir, List.of(new AgentDefinition("planner", "# Planner")));

        assertFalse(Files.exists(dir.resolve(".opencode/agent/reviewer.md")));
        assertEquals("# Planner", Files.readString(dir.resolve(".opencode/agent/planner.md")));
        assertTrue(Files.exists(dir.resolve(".opencode/tool/weather.ts")));
    }

    @Nested
    @DisplayName("generate")
    class GenerateTests {

        @Test
        @DisplayName("random workspace is removed by cleanup")
        void ephemeralWorkspace() {
            GeneratedWorkspace workspace = builder.generate(config(null, null));

            assertFalse(workspace.isDurable());
            assertEquals(baseDir.resolve("workspaces"), workspace.path().getParent());
            assertTrue(Files.exists(workspace.path().resolve("opencode.json")));

            workspace.cleanup();

            assertFalse(Files.exists(workspace.path()));
        }

        @Test
        @DisplayName("session workspace survives cleanup")
        void durableWorkspace() {
            GeneratedWorkspace workspace = builder.generate(config("session-42", null));

            workspace.cleanup();

            assertTrue(workspace.isDurable());
            assertEquals(baseDir.resolve("workspaces").resolve("session-42"), workspace.path());
            assertTrue(Files.exists(workspace.path()));
        }
    }

    @Test
    @DisplayName("destroy is idempotent")
    void destroyTwice() {
        Path dir = builder.create(baseDir.resolve("ws"), config(null, null));

        builder.destroy(dir);
        builder.destroy(dir);

        assertFalse(Files.exists(dir));
    }

    @Test
    @DisplayName("environment overlays secrets on the current environment")
    void buildEnvironment() {
        Map<String, String> env = builder.buildEnvironment(Map.of("GITHUB_TOKEN", "ghp_x"));

        assertEquals("ghp_x", env.get("GITHUB_TOKEN"));
        assertTrue(env.size() >= System.getenv().size());
    }
}
