package com.remotelink.app.endpoints;

import com.remotelink.common.infra.CommandExecutor;
import com.remotelink.common.model.ProcessRecord;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

/**
 * Starts a process. {@code args} may be omitted, in which case
 * {@code command} is split on whitespace.
 */
@Component
public class ProcessExecuteEndpoint implements EndpointHandler {

    private final CommandExecutor executor;

    public ProcessExecuteEndpoint(CommandExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String id() {
        return "process.execute";
    }

    @Override
    public Object handle(HandlerContext context) {
        CommandExecutor.ExecOptions options = new CommandExecutor.ExecOptions(
                context.longValue("timeout_ms"),
                context.bool("capture_output", false));
        ProcessRecord record = executor.execute(context.string("command"), context.stringList("args"), options);
        return ApiResponse.process("Process started", record);
    }
}
