package com.remotelink.app.endpoints;

import com.remotelink.common.config.ConfigService;
import com.remotelink.common.config.RemoteLinkConfig;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check used by the dashboard to discover running clients.
 */
@Component
public class TestEndpoint implements EndpointHandler {

    private final ConfigService configService;

    public TestEndpoint(ConfigService configService) {
        this.configService = configService;
    }

    @Override
    public String id() {
        return "test";
    }

    @Override
    public Object handle(HandlerContext context) {
        RemoteLinkConfig.ClientConfig client = configService.loadConfig().getClient();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", client.getName());
        data.put("port", client.getPort());
        return ApiResponse.success("APIRest is running", data);
    }
}
