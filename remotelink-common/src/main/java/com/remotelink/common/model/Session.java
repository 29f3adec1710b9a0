package com.remotelink.common.model;

import jakarta.annotation.Nullable;

import java.time.Instant;

/**
 * An authenticated caller's session.
 *
 * @param token     opaque bearer token
 * @param username  the user that logged in
 * @param createdAt login time
 * @param expiresAt expiry time, or null when the session does not expire
 */
public record Session(
        String token,
        String username,
        Instant createdAt,
        @Nullable Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
