package com.remotelink.gateway.command;

import com.remotelink.gateway.registry.EndpointKind;
import com.remotelink.gateway.registry.ParamSpec;
import jakarta.annotation.Nullable;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named command the controlling server can trigger through
 * {@code /api/command}. Either a process ({@code argv}) or a built-in
 * {@code action}.
 */
public record CommandSpec(
        String name,
        String title,
        @Nullable String description,
        List<String> argv,
        @Nullable String action,
        List<ParamSpec> args,
        boolean requiresAuth,
        @Nullable Long timeoutMs,
        boolean captureOutput,
        EndpointKind kind,
        Path baseDir) {

    public CommandSpec {
        argv = argv == null ? List.of() : List.copyOf(argv);
        args = args == null ? List.of() : List.copyOf(args);
    }

    public boolean isProcess() {
        return !argv.isEmpty();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("title", title);
        if (description != null) {
            map.put("description", description);
        }
        map.put("type", isProcess() ? "process" : "action");
        map.put("requires_auth", requiresAuth);
        map.put("args", args);
        return map;
    }
}
