package com.remotelink.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for a RemoteLink client, read from
 * {@code ~/.remotelink/config.json}.
 */
@Data
public class RemoteLinkConfig {

    /** Identity reported by test and health. */
    private ClientConfig client;

    /** Login credentials, session lifetime and throttling. */
    private AuthConfig auth;

    /** Where endpoint and command manifests are discovered. */
    private RegistryConfig registry;

    /** Process execution limits. */
    private ExecConfig exec;

    private CorsConfig cors;

    private LogsConfig logs;

    // --- Nested config types ---

    @Data
    public static class ClientConfig {
        /** Display name; defaults to the machine name when unset. */
        private String name;
        private int port = 5000;
    }

    @Data
    public static class AuthConfig {
        private String username = "admin";
        private String password = "password";
        /** Session lifetime in minutes; 0 or less means sessions never expire. */
        private long sessionTtlMinutes = 60;
        private int maxFailures = 5;
        private long cooldownMs = 10000;
    }

    @Data
    public static class RegistryConfig {
        private String endpointsDir = "config/endpoints";
        private String commandsDir = "config/commands";
    }

    @Data
    public static class ExecConfig {
        /** Executable file names allowed to run. Empty or "*" allows all. */
        private List<String> allowedCommands = new ArrayList<>();
        /** 0 disables the timeout. */
        private long defaultTimeoutMs = 0;
        private long killGraceMs = 2000;
        private int historySize = 50;
        private int maxOutputChars = 16384;
    }

    @Data
    public static class CorsConfig {
        private List<String> allowedOrigins = new ArrayList<>(
                List.of("http://localhost:*", "http://127.0.0.1:*"));
    }

    @Data
    public static class LogsConfig {
        /** Log file served by the logs endpoint; null when logging only to console. */
        private String file;
    }
}
