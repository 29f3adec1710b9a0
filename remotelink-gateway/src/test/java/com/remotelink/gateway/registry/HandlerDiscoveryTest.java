package com.remotelink.gateway.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class HandlerDiscoveryTest {

    @TempDir
    Path root;

    private final HandlerDiscovery discovery = HandlerDiscovery.forEndpoints();

    private void touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}");
    }

    private List<String> names(List<DiscoveredUnit> units) {
        return units.stream().map(DiscoveredUnit::name).collect(Collectors.toList());
    }

    @Test
    void simpleFiles_areNamedAfterFile() throws IOException {
        touch("test.json");
        touch("health.json");

        List<DiscoveredUnit> units = discovery.discover(root);

        assertEquals(List.of("health", "test"), names(units));
        assertTrue(units.stream().allMatch(u -> u.kind() == EndpointKind.SIMPLE));
        assertEquals(root, units.get(0).baseDir());
    }

    @Test
    void groupingFolders_areWalkedRecursively() throws IOException {
        touch("auth/login.json");
        touch("auth/logout.json");
        touch("processes/deep/list.json");

        List<DiscoveredUnit> units = discovery.discover(root);

        assertEquals(List.of("login", "logout", "list"), names(units));
        assertEquals("processes/deep/list", units.get(2).relativePath());
    }

    @Test
    void complexDirectory_isOneUnit_andItsFilesArePrivate() throws IOException {
        touch("programs/endpoint.json");
        touch("programs/programs.json");
        touch("programs/helpers/other.json");

        List<DiscoveredUnit> units = discovery.discover(root);

        assertEquals(1, units.size());
        DiscoveredUnit unit = units.get(0);
        assertEquals("programs", unit.name());
        assertEquals(EndpointKind.COMPLEX, unit.kind());
        assertEquals(root.resolve("programs"), unit.baseDir());
        assertEquals(root.resolve("programs/endpoint.json"), unit.manifest());
    }

    @Test
    void exclusions_areSkipped() throws IOException {
        touch("blueprint.json");
        touch("package-info.json");
        touch("disabled/old.json");
        touch("cache/tmp.json");
        touch("__pycache__/x.json");
        touch(".hidden/secret.json");
        touch("notes.txt");
        touch("kept.json");

        assertEquals(List.of("kept"), names(discovery.discover(root)));
    }

    @Test
    void duplicateNames_failDiscovery() throws IOException {
        touch("a/status.json");
        touch("b/status.json");

        RegistryException e = assertThrows(RegistryException.class, () -> discovery.discover(root));
        assertTrue(e.getMessage().contains("status"));
        assertTrue(e.getMessage().contains("a") && e.getMessage().contains("b"));
    }

    @Test
    void complexAndSimpleWithSameName_collide() throws IOException {
        touch("tools/programs.json");
        touch("programs/endpoint.json");

        assertThrows(RegistryException.class, () -> discovery.discover(root));
    }

    @Test
    void commandDiscovery_usesCommandEntryPoint() throws IOException {
        touch("shutdown/command.json");
        touch("programs/endpoint.json");

        List<DiscoveredUnit> units = HandlerDiscovery.forCommands().discover(root);

        // programs/ has no command.json, so it is a grouping folder holding one simple unit
        assertEquals(List.of("endpoint", "shutdown"), names(units));
    }

    @Test
    void entryPointAtRoot_failsDiscovery() throws IOException {
        touch("endpoint.json");
        touch("test.json");

        RegistryException e = assertThrows(RegistryException.class, () -> discovery.discover(root));
        assertTrue(e.getMessage().contains("endpoint.json"));
    }

    @Test
    void otherKindsEntryPointAtRoot_isASimpleUnit() throws IOException {
        touch("command.json");

        assertEquals(List.of("command"), names(discovery.discover(root)));
        assertThrows(RegistryException.class, () -> HandlerDiscovery.forCommands().discover(root));
    }

    @Test
    void missingRoot_fails() {
        assertThrows(RegistryException.class, () -> discovery.discover(root.resolve("absent")));
    }
}
