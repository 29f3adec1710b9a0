package com.remotelink.app.endpoints;

import com.remotelink.common.infra.SystemInfoProvider;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

@Component
public class SystemEndpoint implements EndpointHandler {

    private final SystemInfoProvider systemInfo;

    public SystemEndpoint(SystemInfoProvider systemInfo) {
        this.systemInfo = systemInfo;
    }

    @Override
    public String id() {
        return "system";
    }

    @Override
    public Object handle(HandlerContext context) {
        return ApiResponse.systemInfo(systemInfo.hostInfo());
    }
}
