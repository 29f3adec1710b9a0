package com.remotelink.gateway.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.remotelink.common.infra.CommandExecutor;
import com.remotelink.common.response.AuthException;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.common.response.NotFoundException;
import com.remotelink.gateway.dispatch.PayloadValidator;
import com.remotelink.gateway.registry.DiscoveredUnit;
import com.remotelink.gateway.registry.HandlerDiscovery;
import com.remotelink.gateway.registry.RegistryException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Commands discovered under the commands directory, plus the code that runs
 * them. Process commands go to the {@link CommandExecutor}; action commands
 * go to the {@link CommandAction} registered under their id.
 */
@Slf4j
public class CommandCatalog {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private final Path root;
    private final Map<String, CommandAction> actions = new LinkedHashMap<>();
    private final CommandExecutor executor;
    private final ObjectMapper objectMapper;
    private final HandlerDiscovery discovery = HandlerDiscovery.forCommands();

    private volatile Map<String, CommandSpec> commands = Map.of();

    public CommandCatalog(Path root, Collection<? extends CommandAction> actions,
            CommandExecutor executor, ObjectMapper objectMapper) {
        this.root = root;
        this.executor = executor;
        this.objectMapper = objectMapper;
        for (CommandAction action : actions) {
            if (this.actions.putIfAbsent(action.id(), action) != null) {
                throw new RegistryException("Duplicate command action id '" + action.id() + "'");
            }
        }
        reload();
    }

    /**
     * Re-run discovery and replace the command table.
     *
     * @throws RegistryException the tree is invalid; the old table is kept
     */
    public synchronized int reload() {
        Map<String, CommandSpec> next = new LinkedHashMap<>();
        for (DiscoveredUnit unit : discovery.discover(root)) {
            CommandSpec spec = bind(unit);
            next.put(spec.name(), spec);
            log.debug("Registered command '{}' ({})", spec.name(), spec.isProcess() ? "process" : spec.action());
        }
        commands = Collections.unmodifiableMap(next);
        log.info("Command catalog loaded: {} command(s) from {}", next.size(), root.toAbsolutePath());
        return next.size();
    }

    public Optional<CommandSpec> find(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    public List<CommandSpec> list() {
        return new ArrayList<>(commands.values());
    }

    /**
     * Run a command by name.
     *
     * @param authenticated whether the caller holds a valid session
     * @return the process record for process commands, or the action's result
     * @throws NotFoundException the command does not exist
     * @throws AuthException     the command needs a session and the caller has none
     */
    public Object run(String name, Map<String, Object> payload, boolean authenticated) throws Exception {
        CommandSpec spec = find(name)
                .orElseThrow(() -> new NotFoundException(ErrorCodes.COMMAND_NOT_FOUND, "Command '" + name + "'"));
        if (spec.requiresAuth() && !authenticated) {
            throw new AuthException("command '" + name + "' requires a session");
        }
        PayloadValidator.validate(spec.args(), payload);

        if (spec.isProcess()) {
            List<String> argv = substitute(spec.argv(), payload);
            log.info("Running command '{}' as process {}", name, argv);
            return executor.execute(argv.get(0), argv.subList(1, argv.size()),
                    new CommandExecutor.ExecOptions(spec.timeoutMs(), spec.captureOutput()));
        }
        log.info("Running command '{}' with action '{}'", name, spec.action());
        return actions.get(spec.action()).run(spec, payload);
    }

    // ─── Internals ──────────────────────────────────────────────

    private CommandSpec bind(DiscoveredUnit unit) {
        CommandManifest manifest;
        try {
            manifest = objectMapper.readValue(unit.manifest().toFile(), CommandManifest.class);
        } catch (IOException e) {
            throw new RegistryException("Invalid command manifest " + unit.manifest() + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            manifest = new CommandManifest();
        }
        boolean hasArgv = manifest.getArgv() != null && !manifest.getArgv().isEmpty();
        boolean hasAction = manifest.getAction() != null && !manifest.getAction().isBlank();
        if (hasArgv == hasAction) {
            throw new RegistryException("Command '" + unit.name()
                    + "' must declare exactly one of argv or action (" + unit.manifest() + ")");
        }
        if (hasAction && !actions.containsKey(manifest.getAction())) {
            throw new RegistryException("Command '" + unit.name() + "' refers to unknown action '"
                    + manifest.getAction() + "'");
        }
        String title = manifest.getTitle() == null ? unit.name() : manifest.getTitle();
        return new CommandSpec(unit.name(), title, manifest.getDescription(), manifest.getArgv(),
                hasAction ? manifest.getAction() : null, manifest.getArgs(), manifest.isRequiresAuth(),
                manifest.getTimeoutMs(), manifest.isCaptureOutput(), unit.kind(), unit.baseDir());
    }

    /**
     * Replace {@code {field}} in each argv element with the payload value;
     * a missing field becomes an empty string.
     */
    static List<String> substitute(List<String> argv, Map<String, Object> payload) {
        List<String> result = new ArrayList<>(argv.size());
        for (String part : argv) {
            Matcher matcher = PLACEHOLDER.matcher(part);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                Object value = payload.get(matcher.group(1));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value.toString()));
            }
            matcher.appendTail(sb);
            result.add(sb.toString());
        }
        return result;
    }
}
