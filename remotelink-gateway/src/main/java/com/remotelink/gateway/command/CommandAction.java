package com.remotelink.gateway.command;

import java.util.Map;

/**
 * In-process behavior for commands that declare an {@code action} id.
 */
public interface CommandAction {

    String id();

    /**
     * @param spec    the command being run
     * @param payload validated request payload
     * @return the command result, placed under {@code data.result}
     */
    Object run(CommandSpec spec, Map<String, Object> payload) throws Exception;
}
