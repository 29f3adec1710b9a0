package com.remotelink.app.endpoints;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.NotFoundException;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves the program catalog kept in {@code programs.json} beside the
 * endpoint's manifest.
 */
@Slf4j
@Component
public class ProgramsEndpoint implements EndpointHandler {

    static final String CATALOG_FILE = "programs.json";

    private final ObjectMapper objectMapper;

    public ProgramsEndpoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return "programs";
    }

    @Override
    public Object handle(HandlerContext context) throws IOException {
        Path file = context.baseDir().resolve(CATALOG_FILE);
        if (!Files.isRegularFile(file)) {
            log.warn("Program catalog missing: {}", file);
            throw new NotFoundException("Program catalog");
        }
        Map<String, Object> programs = objectMapper.readValue(file.toFile(),
                new TypeReference<LinkedHashMap<String, Object>>() {
                });
        return ApiResponse.programs(programs == null ? Map.of() : programs);
    }
}
