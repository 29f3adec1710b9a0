package com.remotelink.app.endpoints;

import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import com.remotelink.gateway.registry.EndpointDescriptor;
import com.remotelink.gateway.registry.EndpointRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists every registered endpoint and the folder tree they were found in.
 */
@Component
public class TreeEndpoint implements EndpointHandler {

    // the registry is built from all handlers, this one included
    private final ObjectProvider<EndpointRegistry> registry;

    public TreeEndpoint(ObjectProvider<EndpointRegistry> registry) {
        this.registry = registry;
    }

    @Override
    public String id() {
        return "tree";
    }

    @Override
    public Object handle(HandlerContext context) {
        EndpointRegistry endpoints = registry.getObject();
        List<Map<String, Object>> descriptors = endpoints.descriptors().stream()
                .map(EndpointDescriptor::toMap)
                .collect(Collectors.toList());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("endpoints", descriptors);
        data.put("tree", endpoints.tree());
        return ApiResponse.success("Endpoint tree", data);
    }
}
