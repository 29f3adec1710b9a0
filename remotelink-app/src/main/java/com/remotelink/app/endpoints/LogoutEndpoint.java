package com.remotelink.app.endpoints;

import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ValidationException;
import com.remotelink.gateway.auth.SessionManager;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

/**
 * Ends the session named by the request token (header or {@code token} field).
 */
@Component
public class LogoutEndpoint implements EndpointHandler {

    private final SessionManager sessionManager;

    public LogoutEndpoint(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public String id() {
        return "auth.logout";
    }

    @Override
    public Object handle(HandlerContext context) {
        String token = context.request().authToken();
        if (token == null || token.isBlank()) {
            throw ValidationException.field("token");
        }
        sessionManager.logout(token);
        return ApiResponse.success("Logout successful");
    }
}
