package com.remotelink.gateway.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk description of one endpoint ({@code name.json} or
 * {@code name/endpoint.json}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EndpointManifest {

    /** Handler id to bind; defaults to the endpoint name. */
    private String handler;
    private String description;
    private List<String> methods = new ArrayList<>(List.of("GET", "POST"));
    private boolean requiresAuth;
    private List<ParamSpec> params = new ArrayList<>();
}
