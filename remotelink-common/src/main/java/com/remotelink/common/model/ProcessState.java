package com.remotelink.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a process started by the command executor.
 */
public enum ProcessState {
    RUNNING("running"),
    KILLED("killed"),
    EXITED("exited");

    private final String wireName;

    ProcessState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
