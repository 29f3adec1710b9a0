package com.remotelink.gateway.registry;

/**
 * Invalid handler tree: a name collision, an unreadable manifest or an
 * unknown handler id. Raised while loading, never while serving.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
