package com.remotelink.app.endpoints;

import com.remotelink.common.infra.SystemInfoProvider;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

/**
 * Health check: client name, healthy/degraded status and check time.
 */
@Component
public class HealthEndpoint implements EndpointHandler {

    private final SystemInfoProvider systemInfo;

    public HealthEndpoint(SystemInfoProvider systemInfo) {
        this.systemInfo = systemInfo;
    }

    @Override
    public String id() {
        return "health";
    }

    @Override
    public Object handle(HandlerContext context) {
        return ApiResponse.success("Health check successful", systemInfo.snapshot().toMap());
    }
}
