package com.remotelink.gateway.handler;

import com.remotelink.gateway.registry.RegistryException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Explicit table of handler implementations keyed by id. Manifests refer
 * to handlers only through this table.
 */
@Slf4j
public class HandlerCatalog {

    private final Map<String, EndpointHandler> handlers = new TreeMap<>();

    public HandlerCatalog(Collection<? extends EndpointHandler> handlers) {
        for (EndpointHandler handler : handlers) {
            register(handler);
        }
    }

    private void register(EndpointHandler handler) {
        EndpointHandler existing = handlers.putIfAbsent(handler.id(), handler);
        if (existing != null) {
            throw new RegistryException("Duplicate handler id '" + handler.id() + "': "
                    + existing.getClass().getName() + " and " + handler.getClass().getName());
        }
        log.debug("Registered handler: {}", handler.id());
    }

    public Optional<EndpointHandler> find(String id) {
        return Optional.ofNullable(handlers.get(id));
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
