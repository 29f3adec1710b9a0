package com.remotelink.gateway.registry;

import com.remotelink.gateway.dispatch.HttpMethod;
import com.remotelink.gateway.handler.EndpointHandler;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A routable endpoint: a discovered unit bound to its handler.
 */
public record EndpointDescriptor(
        String name,
        EndpointKind kind,
        String path,
        EndpointHandler handler,
        boolean requiresAuth,
        Set<HttpMethod> methods,
        List<ParamSpec> params,
        String description,
        Path baseDir) {

    public EndpointDescriptor {
        methods = Set.copyOf(methods);
        params = List.copyOf(params);
    }

    public boolean allows(HttpMethod method) {
        return method == HttpMethod.OPTIONS || methods.contains(method);
    }

    /** Declared methods in a stable order, for error messages and listings. */
    public List<String> methodNames() {
        return methods.stream().sorted().map(Enum::name).collect(Collectors.toList());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("kind", kind.wireName());
        map.put("path", path);
        map.put("handler", handler.id());
        map.put("methods", methodNames());
        map.put("requires_auth", requiresAuth);
        map.put("params", params);
        if (description != null) {
            map.put("description", description);
        }
        return map;
    }
}
