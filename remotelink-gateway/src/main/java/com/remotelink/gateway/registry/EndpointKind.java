package com.remotelink.gateway.registry;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a handler unit is laid out on disk.
 */
public enum EndpointKind {
    /** A single manifest file, named after the file. */
    SIMPLE("simple"),
    /** A directory holding an entry-point manifest plus private helper files. */
    COMPLEX("complex");

    private final String wireName;

    EndpointKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
