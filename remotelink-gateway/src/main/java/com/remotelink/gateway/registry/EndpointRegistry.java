package com.remotelink.gateway.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.remotelink.gateway.dispatch.HttpMethod;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerCatalog;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Routable table of endpoints discovered under a root directory.
 * <p>
 * The table is an immutable map behind a volatile reference: lookups take
 * no lock and {@link #reload()} swaps the whole table at once. A failed
 * reload leaves the previous table in place.
 */
@Slf4j
public class EndpointRegistry {

    private final Path root;
    private final HandlerCatalog catalog;
    private final ObjectMapper objectMapper;
    private final HandlerDiscovery discovery = HandlerDiscovery.forEndpoints();

    private volatile Map<String, EndpointDescriptor> table = Map.of();

    /**
     * Build the registry and load it once.
     *
     * @throws RegistryException the tree is invalid
     */
    public EndpointRegistry(Path root, HandlerCatalog catalog, ObjectMapper objectMapper) {
        this.root = root;
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        reload();
    }

    /**
     * Re-run discovery and replace the table.
     *
     * @return number of registered endpoints
     * @throws RegistryException the tree is invalid; the old table is kept
     */
    public synchronized int reload() {
        Map<String, EndpointDescriptor> next = new LinkedHashMap<>();
        for (DiscoveredUnit unit : discovery.discover(root)) {
            EndpointDescriptor descriptor = bind(unit);
            next.put(descriptor.name(), descriptor);
            log.debug("Registered endpoint '{}' ({}, handler={}, auth={})", descriptor.name(),
                    descriptor.kind().wireName(), descriptor.handler().id(), descriptor.requiresAuth());
        }
        table = Collections.unmodifiableMap(next);
        log.info("Endpoint registry loaded: {} endpoint(s) from {}", next.size(), root.toAbsolutePath());
        return next.size();
    }

    public Optional<EndpointDescriptor> resolve(String name) {
        return Optional.ofNullable(table.get(name));
    }

    public List<EndpointDescriptor> descriptors() {
        return new ArrayList<>(table.values());
    }

    public int size() {
        return table.size();
    }

    public Path getRoot() {
        return root;
    }

    /** Key under which a folder holds the endpoint that shares its name. */
    public static final String SELF_KEY = ".";

    /**
     * Nested view of endpoint paths. Folders are maps; a leaf maps the
     * endpoint name to its kind. When {@code name.json} and a {@code name/}
     * folder both exist, the leaf sits in the folder map under {@link #SELF_KEY}.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> tree() {
        Map<String, Object> tree = new TreeMap<>();
        for (EndpointDescriptor descriptor : table.values()) {
            String[] parts = descriptor.path().split("/");
            Map<String, Object> node = tree;
            for (int i = 0; i < parts.length - 1; i++) {
                Object existing = node.get(parts[i]);
                if (existing instanceof Map) {
                    node = (Map<String, Object>) existing;
                    continue;
                }
                Map<String, Object> folder = new TreeMap<>();
                if (existing != null) {
                    folder.put(SELF_KEY, existing);
                }
                node.put(parts[i], folder);
                node = folder;
            }
            String leaf = parts[parts.length - 1];
            String kind = descriptor.kind().wireName();
            if (node.get(leaf) instanceof Map) {
                ((Map<String, Object>) node.get(leaf)).put(SELF_KEY, kind);
            } else {
                node.put(leaf, kind);
            }
        }
        return tree;
    }

    // ─── Binding ────────────────────────────────────────────────

    private EndpointDescriptor bind(DiscoveredUnit unit) {
        EndpointManifest manifest;
        try {
            manifest = objectMapper.readValue(unit.manifest().toFile(), EndpointManifest.class);
        } catch (IOException e) {
            throw new RegistryException("Invalid manifest " + unit.manifest() + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            manifest = new EndpointManifest();
        }

        String handlerId = manifest.getHandler() == null || manifest.getHandler().isBlank()
                ? unit.name()
                : manifest.getHandler();
        List<ParamSpec> params = manifest.getParams() == null ? List.of() : manifest.getParams();
        for (ParamSpec param : params) {
            if (param == null || param.name() == null || param.name().isBlank()) {
                throw new RegistryException("Endpoint '" + unit.name() + "' declares a parameter without a name");
            }
        }
        EndpointHandler handler = catalog.find(handlerId)
                .orElseThrow(() -> new RegistryException("Endpoint '" + unit.name()
                        + "' refers to unknown handler '" + handlerId + "' (" + unit.manifest()
                        + "); known handlers: " + catalog.ids()));

        return new EndpointDescriptor(
                unit.name(),
                unit.kind(),
                unit.relativePath(),
                handler,
                manifest.isRequiresAuth(),
                parseMethods(unit, manifest.getMethods()),
                params,
                manifest.getDescription(),
                unit.baseDir());
    }

    private static Set<HttpMethod> parseMethods(DiscoveredUnit unit, List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return EnumSet.of(HttpMethod.GET, HttpMethod.POST);
        }
        Set<HttpMethod> methods = EnumSet.noneOf(HttpMethod.class);
        for (String value : raw) {
            methods.add(HttpMethod.parse(value).orElseThrow(() -> new RegistryException(
                    "Endpoint '" + unit.name() + "' declares unsupported method '" + value + "'")));
        }
        return methods;
    }
}
