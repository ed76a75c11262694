package com.agentgate.workspace;

import java.nio.file.Path;

/**
 * A workspace produced by {@link WorkspaceBuilder#generate}. Workspaces tied to a
 * durable session id are left in place by {@link #cleanup()}.
 */
public final class GeneratedWorkspace {

    private final Path path;
    private final boolean durable;
    private final WorkspaceBuilder builder;

    GeneratedWorkspace(Path path, boolean durable, WorkspaceBuilder builder) {
        this.path = path;
        this.durable = durable;
        this.builder = builder;
    }

    public Path path() {
        return path;
    }

    public boolean isDurable() {
        return durable;
    }

    public void cleanup() {
        if (!durable) {
            builder.destroy(path);
        }
    }
}
