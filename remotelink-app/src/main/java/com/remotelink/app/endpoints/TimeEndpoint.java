package com.remotelink.app.endpoints;

import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Current local time of the client machine, as the response message.
 */
@Component
public class TimeEndpoint implements EndpointHandler {

    static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public TimeEndpoint() {
        this(Clock.systemDefaultZone());
    }

    TimeEndpoint(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String id() {
        return "get_time";
    }

    @Override
    public Object handle(HandlerContext context) {
        return ApiResponse.success(LocalDateTime.now(clock).format(FORMAT));
    }
}
