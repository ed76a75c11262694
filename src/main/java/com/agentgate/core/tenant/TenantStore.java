package com.agentgate.core.tenant;

import com.agentgate.workspace.AgentDefinition;
import com.agentgate.workspace.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * File-backed tenant records.
 *
 * <p>Layout under the configured data directory:
 * <pre>
 *   tenants/&lt;id&gt;.json
 *   tenants/&lt;id&gt;/tools/&lt;name&gt;.ts
 *   tenants/&lt;id&gt;/agents/&lt;name&gt;.md
 * </pre>
 * Unreadable or missing records are reported as absent.
 */
@Service
public class TenantStore {

    private static final Logger log = LoggerFactory.getLogger(TenantStore.class);

    private final ObjectMapper objectMapper;
    private final Path tenantsDir;

    public TenantStore(ObjectMapper objectMapper, TenantProperties properties) {
        this.objectMapper = objectMapper;
        this.tenantsDir = Path.of(properties.getDataDir()).resolve("tenants");
    }

    public Optional<TenantConfig> findTenant(String tenantId) {
        if (!isSafeId(tenantId)) {
            return Optional.empty();
        }
        Path file = tenantsDir.resolve(tenantId + ".json");
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), TenantConfig.class));
        } catch (IOException e) {
            if (Files.exists(file)) {
                log.warn("Could not read tenant record {}: {}", file, e.getMessage());
            }
            return Optional.empty();
        }
    }

    /** Tools of a tenant sorted by name. */
    public List<ToolDefinition> loadTools(String tenantId) {
        return readSources(tenantsDir.resolve(tenantId).resolve("tools"), ".ts", ToolDefinition::new);
    }

    /** Agents of a tenant sorted by name. */
    public List<AgentDefinition> loadAgents(String tenantId) {
        return readSources(tenantsDir.resolve(tenantId).resolve("agents"), ".md", AgentDefinition::new);
    }

    public void save(TenantConfig tenant) {
        try {
            Files.createDirectories(tenantsDir);
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(tenantsDir.resolve(tenant.id() + ".json").toFile(), tenant);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save tenant " + tenant.id(), e);
        }
    }

    public void saveTool(String tenantId, ToolDefinition tool) {
        writeSource(tenantsDir.resolve(tenantId).resolve("tools"), tool.name() + ".ts", tool.source());
    }

    public void saveAgent(String tenantId, AgentDefinition agent) {
        writeSource(tenantsDir.resolve(tenantId).resolve("agents"), agent.name() + ".md", agent.content());
    }

    private <T> List<T> readSources(Path dir, String extension, BiFunction<String, String, T> factory) {
        var result = new ArrayList<T>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(extension)).sorted().toList()) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - extension.length());
                result.add(factory.apply(name, Files.readString(file, StandardCharsets.UTF_8)));
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + dir, e);
        }
        return result;
    }

    private void writeSource(Path dir, String fileName, String content) {
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(fileName), content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + dir.resolve(fileName), e);
        }
    }

    private static boolean isSafeId(String tenantId) {
        return tenantId != null && tenantId.matches("[A-Za-z0-9-]+");
    }
}
