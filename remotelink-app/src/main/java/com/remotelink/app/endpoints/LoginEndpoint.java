package com.remotelink.app.endpoints;

import com.remotelink.common.model.Session;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.gateway.auth.Credentials;
import com.remotelink.gateway.auth.SessionManager;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class LoginEndpoint implements EndpointHandler {

    private final SessionManager sessionManager;

    public LoginEndpoint(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public String id() {
        return "auth.login";
    }

    @Override
    public Object handle(HandlerContext context) {
        Session session = sessionManager.login(new Credentials(
                context.string("username"),
                context.string("password"),
                context.request().remoteAddr()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("token", session.token());
        data.put("expires_at", session.expiresAt() == null ? null : session.expiresAt().toString());
        return ApiResponse.success("Login successful", data);
    }
}
