package com.remotelink.app.endpoints;

import com.remotelink.common.config.ConfigService;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.common.response.NotFoundException;
import com.remotelink.common.response.ValidationException;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Tail of the client's log file.
 * <p>
 * The file is {@code logs.file} from the client config, falling back to
 * Spring's {@code logging.file.name}.
 */
@Component
public class LogsEndpoint implements EndpointHandler {

    static final int DEFAULT_LINES = 50;
    static final int MAX_LINES = 1000;

    private final ConfigService configService;
    private final Environment environment;

    public LogsEndpoint(ConfigService configService, Environment environment) {
        this.configService = configService;
        this.environment = environment;
    }

    @Override
    public String id() {
        return "logs";
    }

    @Override
    public Object handle(HandlerContext context) throws IOException {
        long lines = context.longValue("lines", DEFAULT_LINES);
        if (lines < 1 || lines > MAX_LINES) {
            throw ValidationException.field("lines");
        }
        String configured = configService.loadConfig().getLogs().getFile();
        if (configured == null || configured.isBlank()) {
            configured = environment.getProperty("logging.file.name");
        }
        if (configured == null || configured.isBlank()) {
            throw new NotFoundException(ErrorCodes.NOT_FOUND, "Log file");
        }
        Path file = Path.of(configured);
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException(ErrorCodes.NOT_FOUND, "Log file " + file.getFileName());
        }
        return ApiResponse.logs(file.getFileName().toString(), tail(file, (int) lines));
    }

    static List<String> tail(Path file, int count) throws IOException {
        Deque<String> window = new ArrayDeque<>(count);
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            lines.forEach(line -> {
                if (window.size() == count) {
                    window.removeFirst();
                }
                window.addLast(line);
            });
        }
        return new ArrayList<>(window);
    }
}
