package com.agentgate.workspace;

import com.agentgate.core.model.ModelSelection;
import com.agentgate.runtime.RuntimeProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Materializes a tenant's tools, agents and provider/model selection into a private
 * directory tree the runtime reads at startup:
 *
 * <pre>
 *   &lt;workspace&gt;/
 *     opencode.json
 *     .opencode/tool/&lt;name&gt;.ts
 *     .opencode/agent/&lt;name&gt;.md
 * </pre>
 *
 * <p>Provider API keys are never written here; they are pushed to the live instance
 * per request. I/O failures surface as {@link UncheckedIOException} and leave the
 * directory in an undefined state.
 */
@Service
public class WorkspaceBuilder {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceBuilder.class);

    static final String CONFIG_FILE = "opencode.json";
    static final String CONFIG_SCHEMA = "https://opencode.ai/config.json";

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final ObjectMapper objectMapper;
    private final Path workspacesRoot;

    public WorkspaceBuilder(ObjectMapper objectMapper, RuntimeProperties properties) {
        this.objectMapper = objectMapper;
        this.workspacesRoot = properties.getBaseDir().resolve("workspaces");
    }

    /**
     * Creates a standalone workspace named after the config's session id, or a random id
     * when there is none.
     */
    public GeneratedWorkspace generate(WorkspaceConfig config) {
        boolean durable = config.sessionId() != null && !config.sessionId().isBlank();
        String workspaceId = durable ? requireSafeName(config.sessionId()) : UUID.randomUUID().toString();
        Path path = create(workspacesRoot.resolve(workspaceId), config);
        return new GeneratedWorkspace(path, durable, this);
    }

    /**
     * Writes a complete workspace into {@code directory}, creating it if needed.
     *
     * @return the directory
     */
    public Path create(Path directory, WorkspaceConfig config) {
        try {
            Files.createDirectories(toolDir(directory));
            Files.createDirectories(agentDir(directory));
            for (ToolDefinition tool : config.tools()) {
                writeFile(toolDir(directory).resolve(requireSafeName(tool.name()) + ".ts"), tool.source());
            }
            writeAgents(directory, config.agents());
            Files.writeString(directory.resolve(CONFIG_FILE),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(runtimeConfig(config)),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace " + directory, e);
        }
        log.debug("Created workspace {} ({} tools, {} agents)",
                directory, config.tools().size(), config.agents().size());
        return directory;
    }

    /**
     * Rewrites the agent subtree of a live workspace so it holds exactly {@code agents}.
     * Tools are left untouched.
     */
    public void syncAgents(Path directory, List<AgentDefinition> agents) {
        try {
            Files.createDirectories(agentDir(directory));
            Set<String> wanted = agents.stream()
                    .map(a -> requireSafeName(a.name()) + ".md")
                    .collect(Collectors.toSet());
            try (Stream<Path> existing = Files.list(agentDir(directory))) {
                for (Path file : existing.toList()) {
                    if (!wanted.contains(file.getFileName().toString())) {
                        Files.deleteIfExists(file);
                    }
                }
            }
            writeAgents(directory, agents);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sync agents into " + directory, e);
        }
    }

    /**
     * Removes a workspace recursively. Missing directories are ignored.
     */
    public void destroy(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
            log.debug("Removed workspace {}", directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove workspace " + directory, e);
        }
    }

    /**
     * Process environment for a runtime launch: the gateway's own environment with the
     * tenant's secrets layered on top.
     */
    public Map<String, String> buildEnvironment(Map<String, String> secrets) {
        var env = new HashMap<>(System.getenv());
        if (secrets != null) {
            env.putAll(secrets);
        }
        return env;
    }

    ObjectNode runtimeConfig(WorkspaceConfig config) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("$schema", CONFIG_SCHEMA);
        if (!config.providers().isEmpty()) {
            ObjectNode providers = root.putObject("provider");
            config.providers().keySet().forEach(providers::putObject);
        }
        ModelSelection model = config.effectiveModel();
        if (model != null) {
            root.put("model", model.qualifiedName());
        }
        return root;
    }

    static Path toolDir(Path workspace) {
        return workspace.resolve(".opencode").resolve("tool");
    }

    static Path agentDir(Path workspace) {
        return workspace.resolve(".opencode").resolve("agent");
    }

    private void writeAgents(Path directory, List<AgentDefinition> agents) throws IOException {
        for (AgentDefinition agent : agents) {
            writeFile(agentDir(directory).resolve(requireSafeName(agent.name()) + ".md"), agent.content());
        }
    }

    private static void writeFile(Path file, String content) throws IOException {
        Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8);
    }

    private static String requireSafeName(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Unsafe workspace file name: " + name);
        }
        return name;
    }
}
