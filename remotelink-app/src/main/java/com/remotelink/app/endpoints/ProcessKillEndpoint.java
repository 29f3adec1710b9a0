package com.remotelink.app.endpoints;

import com.remotelink.common.infra.CommandExecutor;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

@Component
public class ProcessKillEndpoint implements EndpointHandler {

    private final CommandExecutor executor;

    public ProcessKillEndpoint(CommandExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String id() {
        return "process.kill";
    }

    @Override
    public Object handle(HandlerContext context) {
        return ApiResponse.process("Process killed", executor.kill(context.longValue("pid", -1)));
    }
}
