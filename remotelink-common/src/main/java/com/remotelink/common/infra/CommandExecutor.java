package com.remotelink.common.infra;

import com.remotelink.common.config.RemoteLinkConfig;
import com.remotelink.common.model.ProcessRecord;
import com.remotelink.common.response.ApiException;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.common.response.NotFoundException;
import com.remotelink.common.response.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Spawns, kills and lists OS processes on behalf of remote callers.
 * <p>
 * {@link #execute} returns as soon as the process has started. Exit is
 * observed through {@link Process#onExit()}; a finished process leaves the
 * live table and is kept in a bounded history. A process that was killed
 * stays {@code KILLED} even when its exit is observed afterwards.
 */
@Slf4j
public class CommandExecutor {

    /** Per-call options. A null timeout means the configured default. */
    public record ExecOptions(Long timeoutMs, boolean captureOutput) {

        public static ExecOptions defaults() {
            return new ExecOptions(null, false);
        }
    }

    private static final long DRAIN_WAIT_MS = 1000;

    private final RemoteLinkConfig.ExecConfig config;
    private final Map<Long, TrackedProcess> live = new ConcurrentHashMap<>();
    private final Deque<ProcessRecord> history = new ConcurrentLinkedDeque<>();
    private final ScheduledExecutorService scheduler;

    public CommandExecutor(RemoteLinkConfig.ExecConfig config) {
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "remotelink-exec-timer");
            t.setDaemon(true);
            return t;
        });
    }

    // ─── Operations ─────────────────────────────────────────────

    public ProcessRecord execute(String command, List<String> args) {
        return execute(command, args, ExecOptions.defaults());
    }

    /**
     * Start a process. When {@code args} is empty the command string is split
     * into argv, honoring single and double quotes.
     *
     * @throws ValidationException the command is blank or not allowed
     * @throws ApiException        the process could not be started
     */
    public ProcessRecord execute(String command, List<String> args, ExecOptions options) {
        if (command == null || command.isBlank()) {
            throw ValidationException.field("command");
        }
        List<String> safeArgs = args == null ? List.of() : args;
        List<String> argv = new ArrayList<>();
        if (safeArgs.isEmpty()) {
            argv.addAll(tokenize(command));
        } else {
            argv.add(command);
            argv.addAll(safeArgs);
        }
        if (argv.isEmpty()) {
            throw ValidationException.field("command");
        }
        checkAllowed(argv.get(0));

        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectErrorStream(true);
        if (!options.captureOutput()) {
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            String reference = UUID.randomUUID().toString().substring(0, 8);
            log.error("Failed to start '{}' (ref {}): {}", command, reference, e.getMessage(), e);
            throw new ApiException(ApiResponse.internal(reference), e);
        }

        long pid = process.pid();
        OutputTail tail = options.captureOutput() ? new OutputTail(config.getMaxOutputChars()) : null;
        TrackedProcess tracked = new TrackedProcess(process,
                ProcessRecord.running(pid, command, safeArgs, Instant.now()), tail);
        live.put(pid, tracked);
        log.info("Started process {}: {}", pid, argv);

        if (tail != null) {
            Thread reader = new Thread(() -> tail.drain(process.getInputStream()), "remotelink-output-" + pid);
            reader.setDaemon(true);
            reader.start();
        }

        long timeoutMs = options.timeoutMs() != null ? options.timeoutMs() : config.getDefaultTimeoutMs();
        if (timeoutMs > 0) {
            scheduler.schedule(() -> onTimeout(pid), timeoutMs, TimeUnit.MILLISECONDS);
        }
        process.onExit().thenAccept(p -> onExit(pid, p.exitValue()));
        return tracked.snapshot();
    }

    /**
     * Kill a running process: graceful destroy first, forcible after the
     * configured grace period.
     *
     * @throws NotFoundException the pid is unknown or no longer running
     */
    public ProcessRecord kill(long pid) {
        TrackedProcess tracked = live.get(pid);
        ProcessRecord killed = tracked == null ? null : tracked.markKilled(Instant.now());
        if (killed == null) {
            log.warn("Kill requested for unknown or finished process {}", pid);
            throw new NotFoundException(ErrorCodes.PROCESS_NOT_FOUND, "Process " + pid);
        }
        Process process = tracked.process;
        process.destroy();
        scheduler.schedule(() -> {
            if (process.isAlive()) {
                log.debug("Process {} still alive after grace period, forcing", pid);
                process.destroyForcibly();
            }
        }, config.getKillGraceMs(), TimeUnit.MILLISECONDS);
        log.info("Killed process {}", pid);
        return killed;
    }

    /**
     * Snapshot of live processes plus recently finished ones, newest first.
     */
    public List<ProcessRecord> list() {
        List<ProcessRecord> result = new ArrayList<>();
        for (TrackedProcess tracked : live.values()) {
            result.add(tracked.snapshot());
        }
        result.addAll(history);
        result.sort(Comparator.comparing(ProcessRecord::startedAt).reversed());
        return result;
    }

    /**
     * Destroy every live process and stop the timer thread.
     */
    public void shutdown() {
        for (TrackedProcess tracked : live.values()) {
            if (tracked.process.isAlive()) {
                log.info("Destroying process {} on shutdown", tracked.process.pid());
                tracked.process.destroyForcibly();
            }
        }
        scheduler.shutdownNow();
    }

    // ─── Internals ──────────────────────────────────────────────

    private void onTimeout(long pid) {
        TrackedProcess tracked = live.get(pid);
        if (tracked != null && tracked.snapshot().isRunning()) {
            log.warn("Process {} exceeded its timeout", pid);
            try {
                kill(pid);
            } catch (NotFoundException e) {
                log.debug("Process {} finished before its timeout kill", pid);
            }
        }
    }

    private void onExit(long pid, int exitCode) {
        TrackedProcess tracked = live.remove(pid);
        if (tracked == null) {
            return;
        }
        ProcessRecord finished = tracked.markExited(exitCode, Instant.now());
        history.addFirst(finished);
        while (history.size() > Math.max(0, config.getHistorySize())) {
            history.pollLast();
        }
        log.info("Process {} finished: state={}, exitCode={}", pid, finished.state().wireName(), exitCode);
    }

    private void checkAllowed(String executable) {
        List<String> allowed = config.getAllowedCommands();
        if (allowed == null || allowed.isEmpty() || allowed.contains("*")) {
            return;
        }
        Path fileName = Path.of(executable).getFileName();
        String name = fileName == null ? executable : fileName.toString();
        if (!allowed.contains(name)) {
            log.warn("Rejected command not in allowlist: {}", name);
            throw new ValidationException(ErrorCodes.COMMAND_NOT_ALLOWED,
                    "command '" + name + "' is not allowed");
        }
    }

    /**
     * Split a command line on whitespace, keeping quoted sections together.
     */
    static List<String> tokenize(String commandLine) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static final class TrackedProcess {

        private final Process process;
        private final OutputTail tail;
        private ProcessRecord record;

        TrackedProcess(Process process, ProcessRecord record, OutputTail tail) {
            this.process = process;
            this.record = record;
            this.tail = tail;
        }

        synchronized ProcessRecord snapshot() {
            return tail == null ? record : record.withOutput(tail.text());
        }

        /** Returns the killed record, or null when the process is no longer running. */
        synchronized ProcessRecord markKilled(Instant at) {
            if (!record.isRunning()) {
                return null;
            }
            record = record.withKilled(at);
            return snapshot();
        }

        ProcessRecord markExited(int exitCode, Instant at) {
            if (tail != null) {
                tail.awaitDrained(DRAIN_WAIT_MS);
            }
            return applyExit(exitCode, at);
        }

        private synchronized ProcessRecord applyExit(int exitCode, Instant at) {
            if (record.isRunning()) {
                record = record.withExit(exitCode, at);
            }
            return snapshot();
        }
    }

    /** Keeps the last {@code max} characters of a stream. */
    private static final class OutputTail {

        private final int max;
        private final StringBuilder buffer = new StringBuilder();
        private final CountDownLatch drained = new CountDownLatch(1);

        OutputTail(int max) {
            this.max = Math.max(0, max);
        }

        void drain(InputStream in) {
            char[] chunk = new char[4096];
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                int n;
                while ((n = reader.read(chunk)) != -1) {
                    append(chunk, n);
                }
            } catch (IOException e) {
                log.debug("Output stream closed: {}", e.getMessage());
            } finally {
                drained.countDown();
            }
        }

        void awaitDrained(long millis) {
            try {
                drained.await(millis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private synchronized void append(char[] chunk, int n) {
            buffer.append(chunk, 0, n);
            int excess = buffer.length() - max;
            if (excess > 0) {
                buffer.delete(0, excess);
            }
        }

        synchronized String text() {
            return buffer.toString();
        }
    }
}
