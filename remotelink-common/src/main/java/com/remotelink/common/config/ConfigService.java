package com.remotelink.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.remotelink.common.infra.MachineDisplayName;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the RemoteLink configuration file.
 * <p>
 * The file is JSON. {@code ${VAR}} and {@code ${VAR:-default}} are replaced
 * from the environment before parsing. A missing or unreadable file yields
 * defaults.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, RemoteLinkConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public RemoteLinkConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public RemoteLinkConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    private RemoteLinkConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new RemoteLinkConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            RemoteLinkConfig config = objectMapper.readValue(raw, RemoteLinkConfig.class);
            if (config == null) {
                config = new RemoteLinkConfig();
            }
            applyDefaults(config);
            log.info("Config loaded from: {}", configPath);
            log.debug("Effective config: {}", redacted(config));
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new RemoteLinkConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill missing sections with their defaults.
     */
    RemoteLinkConfig applyDefaults(RemoteLinkConfig config) {
        if (config.getClient() == null) {
            config.setClient(new RemoteLinkConfig.ClientConfig());
        }
        if (config.getClient().getName() == null || config.getClient().getName().isBlank()) {
            config.getClient().setName(MachineDisplayName.get());
        }
        if (config.getAuth() == null) {
            config.setAuth(new RemoteLinkConfig.AuthConfig());
        }
        if (config.getRegistry() == null) {
            config.setRegistry(new RemoteLinkConfig.RegistryConfig());
        }
        if (config.getExec() == null) {
            config.setExec(new RemoteLinkConfig.ExecConfig());
        }
        if (config.getCors() == null) {
            config.setCors(new RemoteLinkConfig.CorsConfig());
        }
        if (config.getLogs() == null) {
            config.setLogs(new RemoteLinkConfig.LogsConfig());
        }
        return config;
    }

    /**
     * Convert the config to a plain map, with the password masked.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> redacted(RemoteLinkConfig config) {
        Map<String, Object> map = objectMapper.convertValue(config, Map.class);
        Object auth = map.get("auth");
        if (auth instanceof Map<?, ?> authMap) {
            ((Map<String, Object>) authMap).put("password", "***");
        }
        return map;
    }

    private static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
