package com.remotelink.app.endpoints;

import com.remotelink.common.infra.CommandExecutor;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

@Component
public class ProcessListEndpoint implements EndpointHandler {

    private final CommandExecutor executor;

    public ProcessListEndpoint(CommandExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String id() {
        return "process.list";
    }

    @Override
    public Object handle(HandlerContext context) {
        return ApiResponse.processes("Processes retrieved", executor.list());
    }
}
