package com.remotelink.gateway.registry;

import java.nio.file.Path;

/**
 * A handler unit found on disk, before its manifest is bound.
 *
 * @param name         unique unit name
 * @param kind         simple file or complex directory
 * @param manifest     the manifest file to read
 * @param baseDir      directory holding the unit's private files
 * @param relativePath {@code /}-separated path below the discovery root
 */
public record DiscoveredUnit(String name, EndpointKind kind, Path manifest, Path baseDir, String relativePath) {
}
