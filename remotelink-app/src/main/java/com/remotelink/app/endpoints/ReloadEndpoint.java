package com.remotelink.app.endpoints;

import com.remotelink.common.response.ApiException;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.gateway.command.CommandCatalog;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import com.remotelink.gateway.registry.EndpointRegistry;
import com.remotelink.gateway.registry.RegistryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-runs endpoint and command discovery. A tree that fails to load leaves
 * the current tables in place.
 */
@Slf4j
@Component
public class ReloadEndpoint implements EndpointHandler {

    static final String RELOAD_FAILED = "manifests could not be loaded, previous registry kept";

    private final ObjectProvider<EndpointRegistry> registry;
    private final CommandCatalog commands;

    public ReloadEndpoint(ObjectProvider<EndpointRegistry> registry, CommandCatalog commands) {
        this.registry = registry;
        this.commands = commands;
    }

    @Override
    public String id() {
        return "reload";
    }

    @Override
    public Object handle(HandlerContext context) {
        Map<String, Object> data = new LinkedHashMap<>();
        try {
            data.put("endpoints", registry.getObject().reload());
            data.put("commands", commands.reload());
        } catch (RegistryException e) {
            log.error("Reload failed, keeping the previous tables: {}", e.getMessage(), e);
            throw new ApiException(ApiResponse.internal(ErrorCodes.INVALID_CONFIGURATION, RELOAD_FAILED), e);
        }
        return ApiResponse.success("Registry reloaded", data);
    }
}
