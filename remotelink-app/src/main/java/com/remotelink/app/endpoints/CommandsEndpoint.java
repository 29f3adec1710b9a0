package com.remotelink.app.endpoints;

import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.command.CommandCatalog;
import com.remotelink.gateway.command.CommandSpec;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

@Component
public class CommandsEndpoint implements EndpointHandler {

    private final CommandCatalog commands;

    public CommandsEndpoint(CommandCatalog commands) {
        this.commands = commands;
    }

    @Override
    public String id() {
        return "commands";
    }

    @Override
    public Object handle(HandlerContext context) {
        return ApiResponse.success("Commands retrieved successfully", Map.of("commands",
                commands.list().stream().map(CommandSpec::toMap).collect(Collectors.toList())));
    }
}
