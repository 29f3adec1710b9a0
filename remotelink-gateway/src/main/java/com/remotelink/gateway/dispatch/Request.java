package com.remotelink.gateway.dispatch;

import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A transport-neutral request.
 *
 * @param endpointName requested endpoint
 * @param method       raw method as received; parsed by the dispatcher
 * @param payload      query parameters merged with the JSON body
 * @param authToken    session token if one was supplied
 * @param remoteAddr   caller address
 */
public record Request(
        String endpointName,
        String method,
        Map<String, Object> payload,
        @Nullable String authToken,
        @Nullable String remoteAddr) {

    public Request {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Request of(String endpointName, String method, Map<String, Object> payload) {
        return new Request(endpointName, method, payload, null, null);
    }

    public Request withToken(String token) {
        return new Request(endpointName, method, payload, token, remoteAddr);
    }
}
