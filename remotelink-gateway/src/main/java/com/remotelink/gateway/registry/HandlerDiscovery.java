package com.remotelink.gateway.registry;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a handler tree and finds handler units.
 * <ul>
 * <li>a {@code *.json} file outside the excluded set is a simple unit named
 * after the file;</li>
 * <li>a directory holding the entry-point manifest is a complex unit named
 * after the directory; its other files are private and not walked;</li>
 * <li>any other directory is a grouping folder and is walked.</li>
 * </ul>
 * An entry-point file directly under the root has no directory to name it
 * and fails discovery.
 * Children are visited in sorted order so the result is deterministic.
 */
@Slf4j
public final class HandlerDiscovery {

    public static final String SUFFIX = ".json";
    public static final String ENDPOINT_ENTRY = "endpoint.json";
    public static final String COMMAND_ENTRY = "command.json";

    static final Set<String> EXCLUDED_FILES = Set.of("blueprint.json", "package-info.json");
    static final Set<String> EXCLUDED_DIRS = Set.of("disabled", "cache", "__pycache__");

    private final String entryPoint;

    public HandlerDiscovery(String entryPoint) {
        this.entryPoint = entryPoint;
    }

    public static HandlerDiscovery forEndpoints() {
        return new HandlerDiscovery(ENDPOINT_ENTRY);
    }

    public static HandlerDiscovery forCommands() {
        return new HandlerDiscovery(COMMAND_ENTRY);
    }

    /**
     * Discover all units below {@code root}.
     *
     * @throws RegistryException the root is not a directory, cannot be read,
     *                           holds an entry-point file directly, or two
     *                           units share a name
     */
    public List<DiscoveredUnit> discover(Path root) {
        if (!Files.isDirectory(root)) {
            throw new RegistryException("Handler root is not a directory: " + root.toAbsolutePath());
        }
        Map<String, DiscoveredUnit> byName = new LinkedHashMap<>();
        try {
            walk(root, root, byName);
        } catch (IOException e) {
            throw new RegistryException("Failed to scan handler tree " + root + ": " + e.getMessage(), e);
        }
        log.debug("Discovered {} unit(s) under {}", byName.size(), root);
        return new ArrayList<>(byName.values());
    }

    private void walk(Path root, Path dir, Map<String, DiscoveredUnit> byName) throws IOException {
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream.sorted().collect(Collectors.toList());
        }
        for (Path child : children) {
            String fileName = child.getFileName().toString();
            if (Files.isDirectory(child)) {
                if (isExcludedDir(fileName)) {
                    log.debug("Skipping excluded directory {}", child);
                    continue;
                }
                Path manifest = child.resolve(entryPoint);
                if (Files.isRegularFile(manifest)) {
                    add(byName, new DiscoveredUnit(fileName, EndpointKind.COMPLEX, manifest, child,
                            relative(root, child)));
                } else {
                    walk(root, child, byName);
                }
            } else if (dir.equals(root) && entryPoint.equals(fileName)) {
                throw new RegistryException("Entry point " + child
                        + " sits at the root of the tree and names no unit; move it into a folder");
            } else if (isHandlerFile(fileName)) {
                String name = deriveName(fileName);
                add(byName, new DiscoveredUnit(name, EndpointKind.SIMPLE, child, dir,
                        relative(root, dir.resolve(name))));
            } else {
                log.debug("Ignoring non-handler file {}", child);
            }
        }
    }

    private static void add(Map<String, DiscoveredUnit> byName, DiscoveredUnit unit) {
        DiscoveredUnit existing = byName.putIfAbsent(unit.name(), unit);
        if (existing != null) {
            throw new RegistryException("Duplicate handler name '" + unit.name() + "': "
                    + existing.manifest() + " and " + unit.manifest());
        }
    }

    // ─── Helpers ────────────────────────────────────────────────

    static boolean isExcludedDir(String name) {
        return name.startsWith(".") || EXCLUDED_DIRS.contains(name);
    }

    boolean isHandlerFile(String fileName) {
        return fileName.endsWith(SUFFIX)
                && !fileName.startsWith(".")
                && !EXCLUDED_FILES.contains(fileName)
                && !entryPoint.equals(fileName);
    }

    static String deriveName(String fileName) {
        return fileName.substring(0, fileName.length() - SUFFIX.length());
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
