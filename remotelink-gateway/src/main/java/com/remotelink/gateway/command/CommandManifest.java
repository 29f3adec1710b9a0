package com.remotelink.gateway.command;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.remotelink.gateway.registry.ParamSpec;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk description of one command ({@code name.json} or
 * {@code name/command.json}). Exactly one of {@code argv} and
 * {@code action} must be set.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CommandManifest {

    private String title;
    private String description;
    /** Process to spawn; {@code {field}} placeholders are filled from the payload. */
    private List<String> argv;
    /** Id of a built-in action. */
    private String action;
    private List<ParamSpec> args = new ArrayList<>();
    private boolean requiresAuth;
    private Long timeoutMs;
    private boolean captureOutput;
}
