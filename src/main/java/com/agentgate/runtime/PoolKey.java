package com.agentgate.runtime;

import com.agentgate.workspace.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Identity of a pooled instance: the tenant plus a fingerprint of its tool set.
 * Tenants whose tools change get a new instance; agent changes are synced in place.
 *
 * @param tenantId owning tenant
 * @param toolHash first 12 hex characters of the SHA-256 of {@code {"tools":[sorted names]}}
 */
public record PoolKey(String tenantId, String toolHash) {

    private static final int HASH_LENGTH = 12;

    public static PoolKey of(String tenantId, List<ToolDefinition> tools, ObjectMapper objectMapper) {
        List<String> names = tools.stream().map(ToolDefinition::name).sorted().toList();
        try {
            String document = objectMapper.writeValueAsString(Map.of("tools", names));
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(document.getBytes(StandardCharsets.UTF_8));
            return new PoolKey(tenantId, HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to fingerprint tools for tenant " + tenantId, e);
        }
    }

    /** Name of the instance's workspace directory. */
    public String directoryName() {
        return tenantId + "-" + toolHash;
    }

    @Override
    public String toString() {
        return tenantId + ":" + toolHash;
    }
}
