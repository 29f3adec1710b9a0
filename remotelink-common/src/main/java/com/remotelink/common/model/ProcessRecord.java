package com.remotelink.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a process tracked by the command executor.
 * <p>
 * Instances are immutable; a state change produces a new record via the
 * {@code with*} methods.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessRecord(
        long pid,
        String command,
        List<String> args,
        Instant startedAt,
        ProcessState state,
        Integer exitCode,
        Instant endedAt,
        String output) {

    public ProcessRecord {
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static ProcessRecord running(long pid, String command, List<String> args, Instant startedAt) {
        return new ProcessRecord(pid, command, args, startedAt, ProcessState.RUNNING, null, null, null);
    }

    public ProcessRecord withExit(int code, Instant at) {
        return new ProcessRecord(pid, command, args, startedAt, ProcessState.EXITED, code, at, output);
    }

    public ProcessRecord withKilled(Instant at) {
        return new ProcessRecord(pid, command, args, startedAt, ProcessState.KILLED, exitCode, at, output);
    }

    public ProcessRecord withOutput(String captured) {
        return new ProcessRecord(pid, command, args, startedAt, state, exitCode, endedAt, captured);
    }

    public boolean isRunning() {
        return state == ProcessState.RUNNING;
    }
}
