package com.remotelink.gateway.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A payload field declared by an endpoint or command manifest.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParamSpec(String name, ParamType type, boolean required, String description) {

    public ParamSpec {
        if (type == null) {
            type = ParamType.ANY;
        }
    }

    public static ParamSpec required(String name, ParamType type) {
        return new ParamSpec(name, type, true, null);
    }

    public static ParamSpec optional(String name, ParamType type) {
        return new ParamSpec(name, type, false, null);
    }
}
