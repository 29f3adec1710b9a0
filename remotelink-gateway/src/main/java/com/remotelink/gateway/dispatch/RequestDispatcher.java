package com.remotelink.gateway.dispatch;

import com.remotelink.common.model.Session;
import com.remotelink.common.model.TokenStatus;
import com.remotelink.common.response.ApiException;
import com.remotelink.common.response.ApiResponse;
import com.remotelink.common.response.ErrorCodes;
import com.remotelink.gateway.auth.SessionManager;
import com.remotelink.gateway.handler.HandlerContext;
import com.remotelink.gateway.registry.EndpointDescriptor;
import com.remotelink.gateway.registry.EndpointRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Single entry point for every request: validate, resolve, authenticate,
 * check the payload, invoke the handler, normalize the result.
 * <p>
 * Each step is a hard gate; a request that fails a step never reaches the
 * next one. Handlers run synchronously, once, with no retry.
 */
@Slf4j
public class RequestDispatcher {

    private static final Pattern ENDPOINT_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final EndpointRegistry registry;
    private final SessionManager sessionManager;

    public RequestDispatcher(EndpointRegistry registry, SessionManager sessionManager) {
        this.registry = registry;
        this.sessionManager = sessionManager;
    }

    public ApiResponse dispatch(Request request) {
        // 1. shape
        String name = request.endpointName();
        if (name == null || !ENDPOINT_NAME.matcher(name).matches()) {
            return ApiResponse.badRequest("invalid endpoint name");
        }
        Optional<HttpMethod> parsed = HttpMethod.parse(request.method());
        if (parsed.isEmpty()) {
            return ApiResponse.badRequest("unsupported method '" + request.method() + "'");
        }
        HttpMethod method = parsed.get();

        // 2. resolve
        Optional<EndpointDescriptor> resolved = registry.resolve(name);
        if (resolved.isEmpty()) {
            log.debug("No endpoint named '{}'", name);
            return ApiResponse.notFound(ErrorCodes.ENDPOINT_NOT_FOUND, "Endpoint '" + name + "'");
        }
        EndpointDescriptor descriptor = resolved.get();

        // 3. method
        if (!descriptor.allows(method)) {
            return ApiResponse.methodNotAllowed(method.name(), descriptor.methodNames());
        }
        if (method == HttpMethod.OPTIONS) {
            return ApiResponse.noContent();
        }

        // 4. auth
        TokenStatus tokenStatus = sessionManager.verify(request.authToken());
        Session session = tokenStatus.isValid()
                ? sessionManager.session(request.authToken()).orElse(null)
                : null;
        if (descriptor.requiresAuth() && session == null) {
            log.warn("Rejected unauthenticated call to '{}' from {} (token {})",
                    name, request.remoteAddr(), tokenStatus.name().toLowerCase(Locale.ROOT));
            return ApiResponse.unauthorized("valid session token required");
        }

        // 5. payload
        List<String> invalid = PayloadValidator.invalidFields(descriptor.params(), request.payload());
        if (!invalid.isEmpty()) {
            return ApiResponse.invalidFields(invalid);
        }

        // 6. invoke
        Object result;
        try {
            result = descriptor.handler().handle(new HandlerContext(descriptor, request, session));
        } catch (ApiException e) {
            log.debug("Endpoint '{}' returned {}: {}", name, e.getError().code(), e.getMessage());
            return e.getError();
        } catch (Exception e) {
            String reference = UUID.randomUUID().toString().substring(0, 8);
            log.error("Endpoint '{}' failed (ref {}): {}", name, reference, e.getMessage(), e);
            return ApiResponse.internal(reference);
        }

        // 7. normalize
        return ResponseNormalizer.normalize(result, name);
    }
}
