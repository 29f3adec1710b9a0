package com.remotelink.common.model;

/** Outcome of checking a session token. */
public enum TokenStatus {
    VALID,
    EXPIRED,
    UNKNOWN;

    public boolean isValid() {
        return this == VALID;
    }
}
