package com.remotelink.gateway.dispatch;

import java.util.Locale;
import java.util.Optional;

/**
 * Request methods understood by the dispatcher.
 */
public enum HttpMethod {
    GET,
    POST,
    OPTIONS;

    public static Optional<HttpMethod> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
