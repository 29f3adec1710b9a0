package com.remotelink.app.endpoints;

import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.command.CommandCatalog;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a catalog command by name. The rest of the payload is passed to the
 * command as its arguments.
 */
@Component
public class CommandEndpoint implements EndpointHandler {

    private final CommandCatalog commands;

    public CommandEndpoint(CommandCatalog commands) {
        this.commands = commands;
    }

    @Override
    public String id() {
        return "command";
    }

    @Override
    public Object handle(HandlerContext context) throws Exception {
        String name = context.string("command");
        Object result = commands.run(name, context.payload(), context.session() != null);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("command", name);
        data.put("result", result);
        return ApiResponse.success("Command executed", data);
    }
}
